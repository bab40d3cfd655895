package org.oralhistory.rag.chat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InterviewChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(InterviewChatApplication.class, args);
    }
}
