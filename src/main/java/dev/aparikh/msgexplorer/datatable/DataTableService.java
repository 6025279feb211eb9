package dev.aparikh.msgexplorer.datatable;

import org.springframework.stereotype.Service;

/**
 * Entry point of the aggregation core: resolve, plan, execute.
 */
@Service
public class DataTableService {

    private final QueryResolver resolver;
    private final QueryPlanner planner;

    public DataTableService(QueryResolver resolver, QueryPlanner planner) {
        this.resolver = resolver;
        this.planner = planner;
    }

    public DataTableResult aggregate(DataTableQuery query) {
        return planner.execute(resolver.resolve(query));
    }
}
