package dev.vitae.config;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.MDC;

/**
 * Executor service that runs each task with the MDC of the thread that submitted it, so worker
 * log lines keep the submitting document's id.
 *
 * <p>Futures returned by {@code submit} are created here and run on the delegate's threads;
 * cancelling one with interruption interrupts the worker running it.
 */
public class MdcAwareExecutorService extends AbstractExecutorService {

  private final ExecutorService delegate;

  public MdcAwareExecutorService(ExecutorService delegate) {
    this.delegate = delegate;
  }

  @Override
  public void execute(Runnable command) {
    Map<String, String> submitterMdc = MDC.getCopyOfContextMap();
    delegate.execute(
        () -> {
          if (submitterMdc != null) {
            MDC.setContextMap(submitterMdc);
          }
          try {
            command.run();
          } finally {
            MDC.clear();
          }
        });
  }

  @Override
  public void shutdown() {
    delegate.shutdown();
  }

  @Override
  public List<Runnable> shutdownNow() {
    return delegate.shutdownNow();
  }

  @Override
  public boolean isShutdown() {
    return delegate.isShutdown();
  }

  @Override
  public boolean isTerminated() {
    return delegate.isTerminated();
  }

  @Override
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return delegate.awaitTermination(timeout, unit);
  }
}
