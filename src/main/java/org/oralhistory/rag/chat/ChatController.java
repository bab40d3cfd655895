package org.oralhistory.rag.chat;

import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint exposing the interview chat.
 */
@RestController
@RequestMapping(path = "/api/chat", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ChatResponse chat(@Valid @RequestBody ChatRequest request) {
        String response = chatService.answer(request.sessionOrDefault(), request.participantOrUnknown(),
                request.question());
        return new ChatResponse(response);
    }

    @GetMapping
    public Map<String, String> usage() {
        return Map.of("message", "Please use POST method for chat requests");
    }

    @GetMapping("/history/{participantId}")
    public List<ChatMessage> history(@PathVariable String participantId) {
        return chatService.history(participantId);
    }
}
