/*
 * どこで: Common ストレージ補助
 * 何を: フラットファイルを一時ファイル経由で置き換え、fsync 済みの状態で返す
 * なぜ: 書き込み途中のクラッシュで JSON が壊れたり、未永続の状態で処理が進んだりしないようにするため
 */
package com.atlassupport.common.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

public final class AtomicFileWriter {

  private AtomicFileWriter() {}

  /**
   * 役割: target の内容を content で置き換える。
   * 動作: 同一ディレクトリに一時ファイルを書き、force(true) 後に ATOMIC_MOVE で差し替える。
   * ファイルシステムが atomic move 非対応の場合のみ REPLACE_EXISTING で代替する。
   * 前提: 同じ target への同時書き込みは呼び出し側で直列化すること。
   */
  public static void write(Path target, byte[] content) throws IOException {
    final Path directory = target.toAbsolutePath().getParent();
    if (directory != null) {
      Files.createDirectories(directory);
    }
    final Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
    try {
      try (FileChannel channel =
          FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
        final ByteBuffer buffer = ByteBuffer.wrap(content);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
