package com.company.scheduler.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancelJobRequest {

    @NotBlank(message = "ownerId is required")
    private String ownerId;

    @NotBlank(message = "id is required")
    private String id;
}
