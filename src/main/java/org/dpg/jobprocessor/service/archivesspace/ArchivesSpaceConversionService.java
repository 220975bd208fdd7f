package org.dpg.jobprocessor.service.archivesspace;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.archivesspace.ArchivesSpaceApiClient;
import org.dpg.jobprocessor.common.apiclient.iiif.IiifManifestApiClient;
import org.dpg.jobprocessor.dto.archivesspace.ArchivesSpaceCreateResponse;
import org.dpg.jobprocessor.dto.archivesspace.ArchivesSpaceLocation;
import org.dpg.jobprocessor.dto.archivesspace.ConvertToArchivesSpaceRequest;
import org.dpg.jobprocessor.dto.iiif.IiifManifestStatus;
import org.dpg.jobprocessor.exception.ConversionException;
import org.dpg.jobprocessor.exception.JobProcessorException;
import org.dpg.jobprocessor.exception.ResourceNotFoundException;
import org.dpg.jobprocessor.exception.apiclient.ApiException;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Metadata;
import org.dpg.jobprocessor.model.MetadataType;
import org.dpg.jobprocessor.model.Originator;
import org.dpg.jobprocessor.repository.MetadataRepository;
import org.dpg.jobprocessor.service.job.BackgroundJobRunner;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a metadata record into an external ArchivesSpace record: links a digital object that
 * points at the record's IIIF manifest to the archival object, then re-types the metadata.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArchivesSpaceConversionService {

    public static final String JOB_NAME = "ConvertToAs";
    static final Set<String> SUPPORTED_TYPES = Set.of("archival_objects", "accessions", "resources");

    private final ArchivesSpaceApiClient archivesSpaceApiClient;
    private final IiifManifestApiClient iiifManifestApiClient;
    private final MetadataRepository metadataRepository;
    private final JobStatusService jobStatusService;
    private final BackgroundJobRunner backgroundJobRunner;

    /**
     * Splits a public or relative object URL such as
     * {@code https://archives.lib.virginia.edu/repositories/3/archival_objects/62839} into its
     * repository, object type and object id.
     */
    public static Optional<ArchivesSpaceLocation> parsePublicUrl(final String url) {
        final String[] bits = url.split("/");
        if (bits.length < 4) {
            return Optional.empty();
        }
        final int n = bits.length;
        return Optional.of(new ArchivesSpaceLocation(bits[n - 3], bits[n - 2], bits[n - 1]));
    }

    public Long startConversion(final ConvertToArchivesSpaceRequest request) {
        final Metadata metadata = metadataRepository.findById(request.metadataId()).orElseThrow(
                () -> new ResourceNotFoundException("Metadata " + request.metadataId() + " not found"));
        final ArchivesSpaceLocation location = parsePublicUrl(request.asUrl()).orElseThrow(
                () -> new JobProcessorException(request.asUrl() + " is not a valid public AS URL"));
        if (!SUPPORTED_TYPES.contains(location.parentType())) {
            throw new JobProcessorException("only archival_objects, accessions and resources are supported");
        }

        final JobStatus job = jobStatusService.create(JOB_NAME, Originator.staffMember(request.userId()));
        backgroundJobRunner.launch(job, running -> {
            try {
                convert(running, metadata, location);
            } catch (final ConversionException e) {
                jobStatusService.logFatal(running, e.getMessage());
            }
        });
        return job.getId();
    }

    void convert(final JobStatus job, final Metadata metadata, final ArchivesSpaceLocation location)
            throws ConversionException {
        jobStatusService.logInfo(job, "Convert metadata " + metadata.getId() + " to External ArchivesSpace reference "
                + location.apiPath());
        final JsonNode parent;
        try {
            parent = archivesSpaceApiClient.getObject(location.apiPath());
        } catch (final ApiException e) {
            throw new ConversionException(location.parentType() + ":" + location.parentId() + " not found in repo "
                    + location.repositoryId(), e);
        }

        if (findDigitalObject(job, parent, metadata.getPid())) {
            jobStatusService.logInfo(job, location.parentType() + ":" + location.parentId()
                    + " already has digital object. Use existing.");
        } else {
            jobStatusService.logInfo(job, "No digital object found; creating one for PID " + metadata.getPid());
            createDigitalObject(job, location.repositoryId(), parent, metadata);
        }

        if (metadata.getType() != MetadataType.EXTERNAL) {
            jobStatusService.logInfo(job, "Converting existing metadata record " + metadata.getPid() + " to ExternalMetadata");
            metadata.setType(MetadataType.EXTERNAL);
            metadata.setExternalUri(location.apiPath());
            metadata.setCreatorName("");
            metadata.setCatalogKey("");
            metadata.setCallNumber("");
            metadata.setBarcode("");
            metadataRepository.save(metadata);
        } else {
            jobStatusService.logInfo(job, "Metadata record " + metadata.getPid() + " is already ExternalMetadata");
        }
        jobStatusService.logInfo(job, "ArchivesSpace link successfully created");
    }

    /**
     * True if one of the parent's digital object instances is identified by the metadata PID.
     */
    boolean findDigitalObject(final JobStatus job, final JsonNode parent, final String pid) {
        jobStatusService.logInfo(job, "Look for existing digital object for " + pid);
        final JsonNode instances = parent.path("instances");
        if (!instances.isArray()) {
            return false;
        }
        for (final JsonNode instance : instances) {
            final String ref = instance.path("digital_object").path("ref").asText("");
            if (ref.isEmpty()) {
                continue;
            }
            try {
                final JsonNode digitalObject = archivesSpaceApiClient.getObject(ref);
                if (pid.equals(digitalObject.path("digital_object_id").asText())) {
                    return true;
                }
            } catch (final ApiException e) {
                jobStatusService.logError(job, "Unable to get digital object info: " + e.getMessage());
            }
        }
        return false;
    }

    private void createDigitalObject(final JobStatus job, final String repositoryId, final JsonNode parent,
                                     final Metadata metadata) throws ConversionException {
        final IiifManifestStatus manifest;
        try {
            manifest = iiifManifestApiClient.manifestStatus(metadata.getPid());
        } catch (final ApiException e) {
            throw new ConversionException("Unable to get IIIF manifest for " + metadata.getPid() + ": "
                    + e.getStatusCode() + e.getMessage(), e);
        }
        if (!manifest.cached()) {
            throw new ConversionException("ArchivesSpace create DigitalObject could not find cached IIIF manifest");
        }
        if (!parent.path("instances").isArray()) {
            throw new ConversionException("Unable to get instances data from parent object");
        }

        final Map<String, Object> fileVersion = new LinkedHashMap<>();
        fileVersion.put("use_statement", "image-service-manifest");
        fileVersion.put("file_uri", iiifManifestApiClient.manifestUrl(metadata.getPid()));
        fileVersion.put("publish", false);
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("digital_object_id", metadata.getPid());
        payload.put("title", metadata.getTitle());
        payload.put("publish", false);
        payload.put("file_versions", List.of(fileVersion));

        try {
            final ArchivesSpaceCreateResponse created = archivesSpaceApiClient.createDigitalObject(repositoryId, payload);
            jobStatusService.logInfo(job, "Add newly created digital object " + created.id() + " to parent");
            final ObjectNode updated = parent.deepCopy();
            final ObjectNode instance = ((ArrayNode) updated.get("instances")).addObject();
            instance.put("instance_type", "digital_object");
            instance.putObject("digital_object").put("ref", "/repositories/" + repositoryId + "/digital_objects/" + created.id());
            archivesSpaceApiClient.updateObject(updated.path("uri").asText(), updated);
        } catch (final ApiException e) {
            throw new ConversionException("Unable to create digital object " + e.getStatusCode() + ":" + e.getMessage(), e);
        }
    }
}
