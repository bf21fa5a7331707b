package com.querysentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML bean for the {@code filter} section of the detection configuration.
 *
 * @since 1.0.0
 */
public class FilterSettings {

    private String queryType = QueryLogFilter.DEFAULT_QUERY_TYPE;
    private String executionStatus = QueryLogFilter.DEFAULT_EXECUTION_STATUS;
    private String excludedUser = QueryLogFilter.DEFAULT_EXCLUDED_USER;

    List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (queryType == null || queryType.isBlank()) {
            errors.add("'filter.queryType' must not be blank");
        }
        if (executionStatus == null || executionStatus.isBlank()) {
            errors.add("'filter.executionStatus' must not be blank");
        }
        if (excludedUser == null || excludedUser.isBlank()) {
            errors.add("'filter.excludedUser' must not be blank");
        }
        return errors;
    }

    QueryLogFilter toFilter() {
        return new QueryLogFilter(queryType, executionStatus, excludedUser);
    }

    public String getQueryType() {
        return queryType;
    }

    public void setQueryType(String queryType) {
        this.queryType = queryType;
    }

    public String getExecutionStatus() {
        return executionStatus;
    }

    public void setExecutionStatus(String executionStatus) {
        this.executionStatus = executionStatus;
    }

    public String getExcludedUser() {
        return excludedUser;
    }

    public void setExcludedUser(String excludedUser) {
        this.excludedUser = excludedUser;
    }

    @Override
    public String toString() {
        return "FilterSettings{" +
                "queryType='" + queryType + '\'' +
                ", executionStatus='" + executionStatus + '\'' +
                ", excludedUser='" + excludedUser + '\'' +
                '}';
    }
}
