package com.taskboard.servicebackend.web.dto.task;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Listing query parameters, bound as raw strings; lenient parsing happens in the task layer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskListParams {
    private String completed;
    private String priority;
    private String search;
    private String page;
    private String limit;
}
