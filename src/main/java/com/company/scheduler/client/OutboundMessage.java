package com.company.scheduler.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundMessage {

    // Requested display name; the delivery client applies the allow-list
    private String fromName;

    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    private String subject;
    private String plainTextBody;
    private String htmlBody;
}
