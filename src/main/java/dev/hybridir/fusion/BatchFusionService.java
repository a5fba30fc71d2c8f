package dev.hybridir.fusion;

import dev.hybridir.run.FusionResult;
import dev.hybridir.run.RankedList;
import dev.hybridir.run.Run;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Fuses whole runs query by query on a bounded worker pool.
 *
 * <p>Queries are independent: each worker builds its own {@link CandidatePool} from read-only
 * input lists and shares only the stateless {@link Merger}. The number of queries in flight is
 * bounded by the pool size, so a cancellation request stops new queries from being scheduled
 * while the ones already running finish. Results are returned in lexicographic query order
 * whatever order the workers complete in.
 *
 * <p>A query that some runs lack is fused from the runs that have it (the others contribute an
 * empty list) and reported once, in aggregate, after the batch.
 */
@Service
public class BatchFusionService {

  private static final Logger log = LoggerFactory.getLogger(BatchFusionService.class);

  private final int parallelism;

  public BatchFusionService(@Value("${hybridir.fusion.parallelism:0}") int parallelism) {
    if (parallelism < 0) {
      throw new IllegalArgumentException("parallelism must not be negative: " + parallelism);
    }
    this.parallelism =
        parallelism == 0 ? Runtime.getRuntime().availableProcessors() : parallelism;
  }

  public int parallelism() {
    return parallelism;
  }

  /** Fuses all queries of the runs. */
  public BatchFusionResult fuse(List<Run> runs, FusionConfig config) {
    return fuse(runs, config, () -> false);
  }

  /**
   * Fuses all queries of the runs, checking {@code cancelRequested} before scheduling each query.
   *
   * @param runs the input runs; run order is system order for weights
   * @param config the fusion settings
   * @param cancelRequested polled before each query is scheduled
   * @return fused rankings for every scheduled query
   * @throws FusionConfigurationException if the configuration does not fit the runs; raised before
   *     any query is fused
   */
  public BatchFusionResult fuse(
      List<Run> runs, FusionConfig config, BooleanSupplier cancelRequested) {
    config.checkRunCount(runs.size());
    Merger merger = new Merger(config);

    SortedSet<String> queryIds = new TreeSet<>();
    for (Run run : runs) {
      queryIds.addAll(run.queryIds());
    }
    ConsistencyReport consistency = checkConsistency(runs, queryIds);

    log.info(
        "Fusing {} queries from {} runs with {} (top-k={}, workers={})",
        queryIds.size(),
        runs.size(),
        config.method().configName(),
        config.topK(),
        parallelism);

    Map<String, Future<FusionResult>> pending = new LinkedHashMap<>();
    List<String> skipped = new ArrayList<>();
    boolean cancelled = false;
    Semaphore inFlight = new Semaphore(parallelism);
    ExecutorService executor = Executors.newFixedThreadPool(parallelism, workerThreads());
    try {
      for (String queryId : queryIds) {
        if (cancelled || cancelRequested.getAsBoolean()) {
          cancelled = true;
          skipped.add(queryId);
          continue;
        }
        inFlight.acquire();
        List<RankedList> lists = listsFor(runs, queryId);
        pending.put(
            queryId,
            executor.submit(
                () -> {
                  try {
                    return merger.merge(queryId, lists);
                  } finally {
                    inFlight.release();
                  }
                }));
      }
      executor.shutdown();

      List<FusionResult> results = new ArrayList<>(pending.size());
      for (Future<FusionResult> future : pending.values()) {
        results.add(await(future));
      }

      if (cancelled) {
        log.warn(
            "Fusion cancelled: {} queries fused, {} not scheduled", results.size(), skipped.size());
      } else {
        log.info("Fused {} queries", results.size());
      }
      reportConsistency(consistency);
      return new BatchFusionResult(results, consistency, cancelled, skipped);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      CancellationException cancellation =
          new CancellationException("Interrupted while fusing runs");
      cancellation.initCause(e);
      throw cancellation;
    } finally {
      executor.shutdownNow();
    }
  }

  private static FusionResult await(Future<FusionResult> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Fusion worker failed", cause);
    }
  }

  private static List<RankedList> listsFor(List<Run> runs, String queryId) {
    List<RankedList> lists = new ArrayList<>(runs.size());
    for (Run run : runs) {
      lists.add(run.list(queryId).orElseGet(() -> RankedList.empty(run.system(), queryId)));
    }
    return lists;
  }

  static ConsistencyReport checkConsistency(List<Run> runs, SortedSet<String> queryIds) {
    Map<String, List<String>> missing = new TreeMap<>();
    for (String queryId : queryIds) {
      for (Run run : runs) {
        if (run.list(queryId).isEmpty()) {
          missing.computeIfAbsent(queryId, q -> new ArrayList<>()).add(run.system());
        }
      }
    }
    return ConsistencyReport.of(missing);
  }

  private static void reportConsistency(ConsistencyReport consistency) {
    if (consistency.isConsistent()) {
      return;
    }
    log.warn(
        "{} queries are missing from some runs and were fused from the remaining runs: {}",
        consistency.missingSystems().size(),
        consistency.missingSystems());
  }

  private static ThreadFactory workerThreads() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "fusion-worker-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
