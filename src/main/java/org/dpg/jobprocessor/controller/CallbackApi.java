package org.dpg.jobprocessor.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.dpg.jobprocessor.dto.common.ApiResponse;
import org.dpg.jobprocessor.dto.ocr.OcrCallbackRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;

@Tag(name = "Service Callbacks", description = "Endpoints called by external services when asynchronous work finishes.")
public interface CallbackApi {

    @Operation(summary = "OCR Done Callback",
            description = "Called by the OCR service when the request of a job has finished. Releases the waiting job whatever the outcome.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Callback accepted.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "OCR callback received.",
                                        "response": "ok",
                                        "showMessage": false,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Missing status.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No job with this ID.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<String>> ocrDone(
            @Parameter(description = "The ID of the job that requested OCR.", required = true, example = "1234")
            @PathVariable Long jobId,
            @Valid @RequestBody OcrCallbackRequest callback);
}
