package dev.aparikh.msgexplorer.history;

/**
 * Records user actions for analytics.
 */
public interface ActionHistoryRecorder {

    /**
     * @param type     action type such as {@code data-table}
     * @param contents raw request payload
     */
    void record(ActionContext context, String type, Object contents);
}
