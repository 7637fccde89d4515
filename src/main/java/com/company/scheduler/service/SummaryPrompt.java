package com.company.scheduler.service;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SummaryPrompt {
    private String systemPrompt;
    private String userPrompt;
}
