package org.dpg.jobprocessor.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.dpg.jobprocessor.dto.aptrust.ApTrustWorkItem;
import org.dpg.jobprocessor.dto.archivesspace.ConvertToArchivesSpaceRequest;
import org.dpg.jobprocessor.dto.common.ApiResponse;
import org.dpg.jobprocessor.dto.ocr.OcrRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(name = "Digitization Workflow", description = "Endpoints that start background jobs on units, orders and metadata records. Each returns the ID of the new job.")
public interface WorkflowApi {

    @Operation(summary = "Finalize Unit",
            description = "Validates the unit, moves it to 'finalizing' and starts the finalization job. An approved unit begins finalization; a unit in error restarts it.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Finalization started.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Finalization of unit 42 started.",
                                        "response": 1234,
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - The unit is a re-order, already finalizing or not approved.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Rejected", value = """
                                    {
                                        "displayMessage": "Unit is already finalizing.",
                                        "showMessage": true
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The unit does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Long>> finalizeUnit(
            @Parameter(description = "The ID of the unit to finalize.", required = true, example = "42")
            @PathVariable Long unitId);

    @Operation(summary = "Request OCR",
            description = "Starts an OCR job for all master files of a unit or for one master file. The job waits for the OCR service's callback.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "OCR job started.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Unsupported type or invalid ID.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The unit or master file does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Long>> requestOcr(@Valid @RequestBody OcrRequest request);

    @Operation(summary = "Check Order Ready for Delivery",
            description = "Starts a job that checks whether all patron deliverables of the order are ready and whether the order may be delivered.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Check started.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The order does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Long>> checkOrder(
            @Parameter(description = "The ID of the order.", required = true, example = "9001")
            @PathVariable Long orderId);

    @Operation(summary = "Publish Metadata to Virgo",
            description = "Starts a job that refreshes the IIIF manifest of the record and reindexes it in the discovery system. Only Sirsi and XML metadata can be published.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Publication started.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - The metadata type cannot be published.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Not publishable", value = """
                                    {
                                        "displayMessage": "This metadata is [ExternalMetadata] and not a candidate for publication",
                                        "showMessage": true
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The metadata record does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Long>> publishToVirgo(
            @Parameter(description = "The ID of the metadata record.", required = true, example = "17")
            @PathVariable Long metadataId);

    @Operation(summary = "Submit to APTrust",
            description = "Starts a job that validates the record's preservation bag and uploads it to the APTrust receiving bucket.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Submission started.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Not flagged for preservation, or a submission is still in progress.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The metadata record does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Long>> submitToApTrust(
            @Parameter(description = "The ID of the metadata record.", required = true, example = "17")
            @PathVariable Long metadataId,
            @Parameter(description = "Submit again even though APTrust still has an open work item for the bag.")
            @RequestParam(value = "resubmit", defaultValue = "false") boolean resubmit);

    @Operation(summary = "Get APTrust Status",
            description = "Returns the most recent APTrust ingest work item of the record's bag.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Status found.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "APTrust status retrieved successfully.",
                                        "response": {
                                            "id": 553,
                                            "name": "virginia.edu.tracksys-sirsimetadata-17.tar",
                                            "status": "Success",
                                            "processedAt": "2024-04-02T14:11:09Z"
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown record, or APTrust has no status for it.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ApTrustWorkItem>> getApTrustStatus(
            @Parameter(description = "The ID of the metadata record.", required = true, example = "17")
            @PathVariable Long metadataId);

    @Operation(summary = "Convert to ArchivesSpace",
            description = "Starts a job that links the record's IIIF manifest to an ArchivesSpace object as a digital object and converts the record to external metadata.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Conversion started.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid body or ArchivesSpace URL.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The metadata record does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Long>> convertToArchivesSpace(@Valid @RequestBody ConvertToArchivesSpaceRequest request);
}
