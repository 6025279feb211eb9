package dev.aparikh.msgexplorer.error;

/**
 * A referenced dataset or group does not exist.
 */
public class ReferenceNotFoundException extends DataTableException {

    public ReferenceNotFoundException(String field, String message) {
        super(message, field);
    }

    public static ReferenceNotFoundException dataset(long datasetId) {
        return new ReferenceNotFoundException("dataset", "Dataset " + datasetId + " does not exist");
    }

    public static ReferenceNotFoundException group(long datasetId, long groupId) {
        return new ReferenceNotFoundException("groups",
                "Group " + groupId + " does not exist in dataset " + datasetId);
    }

    @Override
    public String getCode() {
        return "NOT_FOUND";
    }
}
