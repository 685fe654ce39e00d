package com.nevis.digest.controller;

import com.nevis.digest.config.TaskQueueProperties;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigesterStats;
import com.nevis.digest.model.PendingTaskCount;
import com.nevis.digest.model.TaskStats;
import com.nevis.digest.model.WorkerStatus;
import com.nevis.digest.service.DigestAdminService;
import com.nevis.digest.service.TaskScheduler;
import com.nevis.digest.worker.TaskWorker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class StatusController {

    private final TaskScheduler taskScheduler;
    private final TaskWorker taskWorker;
    private final DigestAdminService digestAdminService;
    private final TaskQueueProperties taskQueueProperties;

    @GetMapping("/status/tasks")
    public TaskStats getTaskStats() {
        return taskScheduler.getTaskStats();
    }

    @GetMapping("/status/tasks/pending")
    public PendingTasksResponse getPendingTasks() {
        int maxAttempts = taskQueueProperties.maxAttempts();
        return new PendingTasksResponse(
            taskScheduler.hasReadyTasks(maxAttempts),
            taskScheduler.getPendingTaskCountByType(maxAttempts)
        );
    }

    @GetMapping("/status/worker")
    public WorkerStatus getWorkerStatus() {
        return taskWorker.getStatus();
    }

    @PostMapping("/worker/pause")
    public WorkerStatus pauseWorker() {
        taskWorker.pause();
        return taskWorker.getStatus();
    }

    @PostMapping("/worker/resume")
    public WorkerStatus resumeWorker() {
        taskWorker.resume();
        return taskWorker.getStatus();
    }

    @GetMapping("/status/digests")
    public List<DigesterStats> getDigesterStats() {
        return digestAdminService.getDigesterStats();
    }

    @GetMapping("/digests")
    public List<Digest> getDigests(@RequestParam String path) {
        return digestAdminService.getDigests(path);
    }

    @GetMapping(value = "/archives", produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public byte[] getArchive(@RequestParam String name) {
        return digestAdminService.getArchive(name);
    }

    @PostMapping("/digests/reprocess")
    public ResponseEntity<ReprocessResponse> reprocess(@RequestParam String path) {
        var task = digestAdminService.requestReprocess(path);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new ReprocessResponse(task.id(), path));
    }

    public record PendingTasksResponse(boolean hasReadyTasks, List<PendingTaskCount> byType) {}
}
