package dev.aparikh.msgexplorer.group;

import java.util.Optional;

/**
 * Lookup of saved groups. Groups that were deleted are not found.
 */
public interface GroupCatalog {

    Optional<Group> find(long datasetId, long groupId);
}
