package com.firefly.prdagent.entity;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatSession {

    private String id;
    private String groupId;
    private String documentId;
    private String ownerUserId;
    private String title;
    private LocalDateTime createdAt;
}
