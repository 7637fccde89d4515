package com.company.scheduler.service;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Rendered message body in both formats.
 */
@Data
@AllArgsConstructor
public class GeneratedContent {
    private String plainText;
    private String html;
}
