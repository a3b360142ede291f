package io.github.themoah.breakout.analysis.detect;

import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Utility class for splitting work into fixed-size chunks and processing them one after another.
 * Items within a chunk run concurrently; the chunk size bounds the fan-out.
 */
public final class ChunkProcessor {

  private ChunkProcessor() {}

  /**
   * Splits items into consecutive chunks of at most chunkSize items, preserving order.
   *
   * @param items the items to split
   * @param chunkSize maximum items per chunk (values below 1 are treated as 1)
   * @return list of chunks
   */
  public static <T> List<List<T>> partition(List<T> items, int chunkSize) {
    if (items.isEmpty()) {
      return List.of();
    }

    int size = Math.max(1, chunkSize);
    List<List<T>> chunks = new ArrayList<>((items.size() + size - 1) / size);
    for (int start = 0; start < items.size(); start += size) {
      chunks.add(new ArrayList<>(items.subList(start, Math.min(start + size, items.size()))));
    }
    return chunks;
  }

  /**
   * Processes chunks sequentially: the next chunk starts once the previous chunk's future completes.
   * The first failure stops the chain.
   *
   * @param chunks the chunks to process
   * @param processor function that processes a chunk and returns a Future with the result
   * @return Future containing all chunk results in order
   */
  public static <T, R> Future<List<R>> processSequentially(
      List<List<T>> chunks, Function<List<T>, Future<R>> processor) {

    if (chunks.isEmpty()) {
      return Future.succeededFuture(List.of());
    }

    List<R> results = new ArrayList<>(chunks.size());
    Future<Void> chain = Future.succeededFuture();

    for (List<T> chunk : chunks) {
      chain = chain.compose(v -> processor.apply(chunk).<Void>map(r -> {
        results.add(r);
        return null;
      }));
    }

    return chain.map(v -> results);
  }
}
