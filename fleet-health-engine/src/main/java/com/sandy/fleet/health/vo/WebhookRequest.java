package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/** Create / partial update payload; null fields are left untouched on update. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookRequest {
    private String name;
    private String url;
    private String secret;
    private Set<String> events;
    private Boolean active;
}
