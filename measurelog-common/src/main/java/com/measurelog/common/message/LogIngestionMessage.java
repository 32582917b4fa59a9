package com.measurelog.common.message;

import com.measurelog.common.entity.LogFile;

public record LogIngestionMessage(Long logId) {

    public static LogIngestionMessage from(LogFile logFile) {
        return new LogIngestionMessage(logFile.getId());
    }
}
