package com.logstore.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement of a pushed registry event
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistryEventResponse {
    private boolean accepted;
    private Integer handlersNotified;
    private String message;
}
