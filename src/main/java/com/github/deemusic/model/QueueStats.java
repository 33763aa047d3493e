package com.github.deemusic.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class QueueStats {

    private final long pending;
    private final long downloading;
    private final long paused;
    private final long completed;
    private final long failed;

    public long getTotal() {
        return pending + downloading + paused + completed + failed;
    }
}
