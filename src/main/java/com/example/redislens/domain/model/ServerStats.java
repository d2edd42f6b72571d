package com.example.redislens.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Properties;
import java.util.regex.Pattern;

/**
 * INFO 결과에서 콘솔 대시보드에 필요한 지표만 추린 Value Object
 *
 * INFO에 없는 항목은 0 (human 표기는 "0B")으로 채운다.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class ServerStats {

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final Memory memory;
    private final Keys keys;
    private final Performance performance;

    @Getter
    @Builder
    @ToString
    @EqualsAndHashCode
    public static class Memory {
        private final long usedMemory;
        private final String usedMemoryHuman;
        private final long usedMemoryPeak;
        private final String usedMemoryPeakHuman;
        private final long usedMemoryDataset;
        private final double memFragmentationRatio;
    }

    @Getter
    @Builder
    @ToString
    @EqualsAndHashCode
    public static class Keys {
        private final long total;
    }

    @Getter
    @Builder
    @ToString
    @EqualsAndHashCode
    public static class Performance {
        private final long instantaneousOpsPerSec;
        private final long totalCommandsProcessed;
        private final long totalConnectionsReceived;
        private final long connectedClients;
    }

    /**
     * INFO 응답과 DBSIZE 값으로 통계 생성
     */
    public static ServerStats from(Properties info, long keyCount) {
        return ServerStats.builder()
                .memory(Memory.builder()
                        .usedMemory(asLong(info, "used_memory"))
                        .usedMemoryHuman(info.getProperty("used_memory_human", "0B"))
                        .usedMemoryPeak(asLong(info, "used_memory_peak"))
                        .usedMemoryPeakHuman(info.getProperty("used_memory_peak_human", "0B"))
                        .usedMemoryDataset(asLong(info, "used_memory_dataset"))
                        .memFragmentationRatio(asDouble(info, "mem_fragmentation_ratio"))
                        .build())
                .keys(Keys.builder()
                        .total(keyCount)
                        .build())
                .performance(Performance.builder()
                        .instantaneousOpsPerSec(asLong(info, "instantaneous_ops_per_sec"))
                        .totalCommandsProcessed(asLong(info, "total_commands_processed"))
                        .totalConnectionsReceived(asLong(info, "total_connections_received"))
                        .connectedClients(asLong(info, "connected_clients"))
                        .build())
                .build();
    }

    private static long asLong(Properties info, String name) {
        String value = info.getProperty(name);
        if (value == null || !INTEGER.matcher(value.trim()).matches()) {
            return 0L;
        }
        return Long.parseLong(value.trim());
    }

    private static double asDouble(Properties info, String name) {
        String value = info.getProperty(name);
        if (value == null || !DECIMAL.matcher(value.trim()).matches()) {
            return 0.0;
        }
        return Double.parseDouble(value.trim());
    }
}
