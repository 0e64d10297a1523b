/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

public class DocumentLifecycleManagerTest {
    private static final String URI = "file:///a.yaml";

    @Test
    public void runsScheduledTask() throws Exception {
        DocumentLifecycleManager manager = new DocumentLifecycleManager();
        AtomicInteger runs = new AtomicInteger();

        manager.schedule(URI, 0, runs::incrementAndGet).get(5, TimeUnit.SECONDS);

        assertThat(runs.get(), equalTo(1));
    }

    @Test
    public void debouncesRepeatedScheduling() throws Exception {
        DocumentLifecycleManager manager = new DocumentLifecycleManager();
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();

        var cancelled = manager.schedule(URI, 10_000, first::incrementAndGet);
        manager.schedule(URI, 10, second::incrementAndGet).get(5, TimeUnit.SECONDS);

        assertThat(cancelled.isCancelled(), is(true));
        assertThat(first.get(), equalTo(0));
        assertThat(second.get(), equalTo(1));
    }

    @Test
    public void cancelledTaskNeverRuns() throws Exception {
        DocumentLifecycleManager manager = new DocumentLifecycleManager();
        AtomicInteger runs = new AtomicInteger();

        manager.schedule(URI, 200, runs::incrementAndGet);
        manager.cancelTask(URI);
        Thread.sleep(400);

        assertThat(runs.get(), equalTo(0));
        assertThat(manager.getTask(URI), nullValue());
    }

    @Test
    public void startedTaskRunsToCompletion() throws Exception {
        DocumentLifecycleManager manager = new DocumentLifecycleManager();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();

        manager.schedule(URI, 0, () -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            finished.incrementAndGet();
        });
        assertThat(started.await(5, TimeUnit.SECONDS), is(true));
        manager.cancelTask(URI);
        release.countDown();
        Thread.sleep(200);

        assertThat(finished.get(), equalTo(1));
    }

    @Test
    public void tasksOfDifferentDocumentsAreIndependent() throws Exception {
        DocumentLifecycleManager manager = new DocumentLifecycleManager();
        AtomicInteger runs = new AtomicInteger();

        manager.schedule(URI, 50, runs::incrementAndGet);
        manager.schedule("file:///b.yaml", 50, runs::incrementAndGet);
        manager.waitForAllTasks();

        assertThat(runs.get(), equalTo(2));
    }

    @Test
    public void completedTaskIsForgotten() throws Exception {
        DocumentLifecycleManager manager = new DocumentLifecycleManager();

        manager.schedule(URI, 0, () -> { }).get(5, TimeUnit.SECONDS);
        Thread.sleep(50);

        assertThat(manager.getTask(URI), nullValue());
    }

    @Test
    public void cancelsAllTasks() throws Exception {
        DocumentLifecycleManager manager = new DocumentLifecycleManager();
        AtomicInteger runs = new AtomicInteger();

        manager.schedule(URI, 200, runs::incrementAndGet);
        manager.schedule("file:///b.yaml", 200, runs::incrementAndGet);
        manager.cancelAllTasks();
        Thread.sleep(400);

        assertThat(runs.get(), equalTo(0));
    }
}
