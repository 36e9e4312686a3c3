/*
 * どこで: Hunt Repository 層
 * 何を: id をキーとするエンティティ集合を JSON 配列ファイルとして保持する
 * なぜ: フラットファイルに対して「保存が返った時点で fsync 済み」を満たす共通実装を提供するため
 */
package com.atlassupport.hunt.repository;

import com.atlassupport.common.storage.AtomicFileWriter;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class JsonFileCollection<T> {

  private static final Logger logger = LoggerFactory.getLogger(JsonFileCollection.class);

  private final Path path;
  private final ObjectMapper objectMapper;
  private final JavaType listType;
  private final Function<T, String> idOf;
  private final ReentrantLock writeLock = new ReentrantLock();

  // 書き込み成功後にのみ差し替える。読み取りはロックなしでこのスナップショットを参照する
  private volatile Map<String, T> snapshot;

  JsonFileCollection(
      Path path, ObjectMapper objectMapper, Class<T> elementType, Function<T, String> idOf) {
    this.path = path;
    // ファイル形式は注入された ObjectMapper の設定に依存させない
    this.objectMapper =
        objectMapper
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    this.listType =
        this.objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
    this.idOf = idOf;
    this.snapshot = load();
  }

  Optional<T> find(String id) {
    return Optional.ofNullable(snapshot.get(id));
  }

  List<T> listAll() {
    return List.copyOf(snapshot.values());
  }

  /**
   * 役割: エンティティを追加/置換し、ファイルへ同期的に書き出す。
   * 動作: 集合全体を一時ファイルへ書いて fsync し、atomic move で置き換えてからメモリ上の値を更新する。
   * 前提: 書き込み失敗時は StoreUnavailableException を送出し、メモリ上の値は変更しない。
   */
  T put(T entity) {
    writeLock.lock();
    try {
      final Map<String, T> next = new TreeMap<>(snapshot);
      next.put(idOf.apply(entity), entity);
      write(next);
      snapshot = next;
      return entity;
    } finally {
      writeLock.unlock();
    }
  }

  private Map<String, T> load() {
    if (!Files.exists(path)) {
      final Map<String, T> empty = new TreeMap<>();
      write(empty);
      logger.info("created empty store file path={}", path);
      return empty;
    }
    try {
      final List<T> entities = objectMapper.readValue(path.toFile(), listType);
      final Map<String, T> loaded = new TreeMap<>();
      for (T entity : entities) {
        final T previous = loaded.put(idOf.apply(entity), entity);
        if (previous != null) {
          throw new StoreUnavailableException(
              "duplicate id in store file path=" + path + " id=" + idOf.apply(entity), null);
        }
      }
      logger.info("loaded store file path={} size={}", path, loaded.size());
      return loaded;
    } catch (IOException ex) {
      throw new StoreUnavailableException("failed to load store file path=" + path, ex);
    }
  }

  private void write(Map<String, T> entities) {
    try {
      final byte[] content =
          objectMapper
              .writerWithDefaultPrettyPrinter()
              .writeValueAsBytes(new ArrayList<>(entities.values()));
      AtomicFileWriter.write(path, content);
    } catch (IOException ex) {
      logger.error("failed to write store file path={}", path, ex);
      throw new StoreUnavailableException("failed to write store file path=" + path, ex);
    }
  }
}
