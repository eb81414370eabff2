package com.jobrunner.worker;

import com.jobrunner.core.JobDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory FIFO source. Rejected jobs go to the back of the queue.
 */
public class QueueJobSource implements JobSource {

    private final Queue<JobDescriptor> queue = new ConcurrentLinkedQueue<>();
    private final List<JobDescriptor> completed = new CopyOnWriteArrayList<>();
    private final List<JobDescriptor> failed = new CopyOnWriteArrayList<>();
    private final AtomicInteger rejections = new AtomicInteger(0);

    public QueueJobSource add(JobDescriptor job) {
        if (job == null) {
            throw new NullPointerException("Job cannot be null");
        }
        queue.offer(job);
        return this;
    }

    @Override
    public Optional<JobDescriptor> poll() {
        return Optional.ofNullable(queue.poll());
    }

    @Override
    public void reject(JobDescriptor job, String reason) {
        rejections.incrementAndGet();
        queue.offer(job);
    }

    @Override
    public void onCompleted(JobDescriptor job) {
        completed.add(job);
    }

    @Override
    public void onFailed(JobDescriptor job, String reason) {
        failed.add(job);
    }

    public int size() {
        return queue.size();
    }

    public int getRejections() {
        return rejections.get();
    }

    public List<JobDescriptor> getCompleted() {
        return new ArrayList<>(completed);
    }

    public List<JobDescriptor> getFailed() {
        return new ArrayList<>(failed);
    }
}
