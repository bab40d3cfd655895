package org.oralhistory.rag.chat;

import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness message on the root path.
 */
@RestController
public class StatusController {

    @GetMapping("/")
    public Map<String, String> index() {
        return Map.of("message", "API is running");
    }
}
