package com.github.deemusic.controller;

import com.github.deemusic.service.ProgressBroadcastService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Slf4j
@RestController
@RequestMapping("/api/progress")
@RequiredArgsConstructor
public class ProgressController {

    private final ProgressBroadcastService progressBroadcastService;

    /**
     * SSE stream of queue item changes
     */
    @GetMapping("/stream")
    public SseEmitter streamProgress() {
        log.info("New progress stream client, {} already connected", progressBroadcastService.getActiveConnections());
        return progressBroadcastService.createEmitter();
    }
}
