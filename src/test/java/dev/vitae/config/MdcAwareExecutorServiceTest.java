package dev.vitae.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcAwareExecutorServiceTest {

  private final ExecutorService delegate = Executors.newSingleThreadExecutor();
  private final ExecutorService executor = new MdcAwareExecutorService(delegate);

  @AfterEach
  void tearDown() {
    MDC.clear();
    executor.shutdownNow();
  }

  @Test
  void taskSeesSubmitterMdc() throws Exception {
    MDC.put("documentId", "jane.pdf");

    Future<String> seen = executor.submit(() -> MDC.get("documentId"));

    assertThat(seen.get(5, TimeUnit.SECONDS)).isEqualTo("jane.pdf");
  }

  @Test
  void workerMdcIsClearedAfterEachTask() throws Exception {
    MDC.put("documentId", "jane.pdf");
    executor.submit(() -> MDC.put("stage", "extraction")).get(5, TimeUnit.SECONDS);
    MDC.clear();

    Future<Map<String, String>> next = executor.submit(MDC::getCopyOfContextMap);

    assertThat(next.get(5, TimeUnit.SECONDS)).isNullOrEmpty();
  }

  @Test
  void taskSubmittedWithoutMdcRunsWithEmptyContext() throws Exception {
    Future<String> seen = executor.submit(() -> MDC.get("documentId"));

    assertThat(seen.get(5, TimeUnit.SECONDS)).isNull();
  }

  @Test
  void cancellingFutureInterruptsWorker() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch interrupted = new CountDownLatch(1);
    Future<?> future =
        executor.submit(
            () -> {
              started.countDown();
              try {
                new CountDownLatch(1).await();
              } catch (InterruptedException e) {
                interrupted.countDown();
              }
            });
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    future.cancel(true);

    assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(future.isCancelled()).isTrue();
  }

  @Test
  void lifecycleIsDelegated() throws Exception {
    executor.shutdown();

    assertThat(executor.isShutdown()).isTrue();
    assertThat(delegate.isShutdown()).isTrue();
    assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    assertThat(executor.isTerminated()).isTrue();
  }
}
