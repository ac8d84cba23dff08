package com.postpilot.scheduler.collaborator;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentPiece {
    private UUID id;
    private UUID tenantId;
    private String title;
    private String body;
    private List<String> hashtags;
    private List<String> mediaUrls;
}
