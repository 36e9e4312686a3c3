/*
 * どこで: Hunt 設定
 * 何を: 専門家/優先度/チケットを保存するフラットファイルのパスを保持する
 * なぜ: データ配置をデプロイ環境から指定できるようにするため
 */
package com.atlassupport.hunt.config;

import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "hunt.storage")
@Validated
public record HuntStorageProperties(
    @NotNull Path expertsPath, @NotNull Path userPrioritiesPath, @NotNull Path ticketsPath) {}
