package org.dpg.jobprocessor.dto.archivesspace;

/**
 * Repository, object type and id of an ArchivesSpace object, as parsed from its public URL.
 */
public record ArchivesSpaceLocation(String repositoryId, String parentType, String parentId) {

    public String apiPath() {
        return "/repositories/" + repositoryId + "/" + parentType + "/" + parentId;
    }
}
