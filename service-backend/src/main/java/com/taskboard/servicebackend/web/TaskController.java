package com.taskboard.servicebackend.web;

import com.taskboard.servicebackend.security.AuthenticatedUser;
import com.taskboard.servicebackend.task.PageSpec;
import com.taskboard.servicebackend.task.Task;
import com.taskboard.servicebackend.task.TaskFilter;
import com.taskboard.servicebackend.task.TaskPage;
import com.taskboard.servicebackend.task.TaskQueryService;
import com.taskboard.servicebackend.task.TaskService;
import com.taskboard.servicebackend.web.dto.ApiResponse;
import com.taskboard.servicebackend.web.dto.PaginatedResponse;
import com.taskboard.servicebackend.web.dto.PaginationDto;
import com.taskboard.servicebackend.web.dto.task.CreateTaskRequest;
import com.taskboard.servicebackend.web.dto.task.TaskDto;
import com.taskboard.servicebackend.web.dto.task.TaskListParams;
import com.taskboard.servicebackend.web.dto.task.TaskStatsDto;
import com.taskboard.servicebackend.web.dto.task.UpdateTaskRequest;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task endpoints. Every call is scoped to the authenticated user.
 */
@RestController
@RequestMapping("/api/tasks")
@Validated
public class TaskController {

    private static final String INVALID_ID = "id must be a positive integer";

    private final TaskService taskService;
    private final TaskQueryService queryService;

    public TaskController(TaskService taskService, TaskQueryService queryService) {
        this.taskService = taskService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Map<String, TaskDto>>> create(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @RequestBody CreateTaskRequest request) {
        Task task = taskService.create(principal.id(), request.toInput());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("Task created successfully", Map.of("task", TaskDto.from(task))));
    }

    @GetMapping
    public ResponseEntity<PaginatedResponse<TaskDto>> list(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @ModelAttribute TaskListParams params) {
        TaskFilter filter = TaskFilter.parse(params.getCompleted(), params.getPriority(), params.getSearch());
        PageSpec pageSpec = PageSpec.parse(params.getPage(), params.getLimit());

        TaskPage page = queryService.list(principal.id(), filter, pageSpec);
        List<TaskDto> items = page.items().stream().map(TaskDto::from).toList();
        String message = page.total() == 0 ? "No tasks found" : "Tasks retrieved successfully";
        return ResponseEntity.ok(PaginatedResponse.of(message, items, PaginationDto.from(page)));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<Map<String, TaskStatsDto>>> stats(
            @AuthenticationPrincipal AuthenticatedUser principal) {
        TaskStatsDto stats = TaskStatsDto.from(queryService.stats(principal.id()));
        return ResponseEntity.ok(ApiResponse.ok("Statistics retrieved successfully", Map.of("stats", stats)));
    }

    @DeleteMapping("/completed")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> deleteCompleted(
            @AuthenticationPrincipal AuthenticatedUser principal) {
        int deleted = queryService.deleteCompleted(principal.id());
        return ResponseEntity.ok(ApiResponse.ok(deleted + " completed task(s) deleted",
                Map.of("deletedCount", deleted)));
    }

    @PutMapping("/mark-all-completed")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> markAllCompleted(
            @AuthenticationPrincipal AuthenticatedUser principal) {
        int updated = queryService.markAllCompleted(principal.id());
        return ResponseEntity.ok(ApiResponse.ok(updated + " task(s) marked as completed",
                Map.of("updatedCount", updated)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, TaskDto>>> get(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable @Positive(message = INVALID_ID) Long id) {
        Task task = taskService.get(principal.id(), id);
        return ResponseEntity.ok(ApiResponse.ok("Task retrieved successfully", Map.of("task", TaskDto.from(task))));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> update(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable @Positive(message = INVALID_ID) Long id,
            @RequestBody UpdateTaskRequest request) {
        TaskService.UpdateResult result = taskService.update(principal.id(), id, request.toInput());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task", TaskDto.from(result.task()));
        data.put("fieldsUpdated", result.fieldsUpdated());
        return ResponseEntity.ok(ApiResponse.ok("Task updated successfully", data));
    }

    @PatchMapping("/{id}/toggle")
    public ResponseEntity<ApiResponse<Map<String, TaskDto>>> toggle(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable @Positive(message = INVALID_ID) Long id) {
        Task task = taskService.toggle(principal.id(), id);
        String message = task.isCompleted() ? "Task marked as completed" : "Task marked as pending";
        return ResponseEntity.ok(ApiResponse.ok(message, Map.of("task", TaskDto.from(task))));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable @Positive(message = INVALID_ID) Long id) {
        taskService.delete(principal.id(), id);
        return ResponseEntity.ok(ApiResponse.ok("Task deleted successfully"));
    }
}
