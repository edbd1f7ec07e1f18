package com.guno.orderpipeline.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * Error details for one rejected record or one failed batch step
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorReport {

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    private String entityType;
    private String entityId;
    private Long position;
    private RejectionReason reason;
    private String errorCode;
    private String errorMessage;

    public static ErrorReport rejection(String entityId, long position, RejectionReason reason, String message) {
        return ErrorReport.builder()
                .entityType("ORDER")
                .entityId(entityId)
                .position(position)
                .reason(reason)
                .errorCode("REJECTED_" + reason.name())
                .errorMessage(message)
                .build();
    }
}
