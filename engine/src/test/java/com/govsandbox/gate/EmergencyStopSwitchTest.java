package com.govsandbox.gate;

import com.govsandbox.audit.HashChainedAuditLog;
import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import com.govsandbox.domain.AuditEventKind;
import com.govsandbox.domain.ComplianceTier;
import com.govsandbox.domain.PayloadKeys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("unchecked")
class EmergencyStopSwitchTest {

    @Mock
    private HashChainedAuditLog auditLog;

    @InjectMocks
    private EmergencyStopSwitch emergencyStop;

    @Test
    @DisplayName("trigger halts and witnesses once; a second trigger is a no-op")
    void triggerIsIdempotent() {
        assertThat(emergencyStop.trigger("operator", "drill")).isTrue();
        assertThat(emergencyStop.trigger("operator", "again")).isFalse();

        assertThat(emergencyStop.isHalted()).isTrue();
        ArgumentCaptor<Map<String, String>> payload = ArgumentCaptor.forClass(Map.class);
        verify(auditLog, times(1)).witness(eq(AuditEventKind.EMERGENCY_STOP_TRIGGERED), eq("operator"), payload.capture(),
                eq(ComplianceTier.LAW_TIER));
        assertThat(payload.getValue()).containsEntry(PayloadKeys.REASON, "drill");
    }

    @Test
    @DisplayName("clear lowers the flag after witnessing; clearing when not halted does nothing")
    void clear() {
        assertThat(emergencyStop.clear("operator", "nothing to clear")).isFalse();
        emergencyStop.trigger("operator", "drill");

        assertThat(emergencyStop.clear("operator", "done")).isTrue();

        assertThat(emergencyStop.isHalted()).isFalse();
        verify(auditLog, times(1)).witness(eq(AuditEventKind.EMERGENCY_STOP_CLEARED), eq("operator"), anyMap(),
                eq(ComplianceTier.LAW_TIER));
    }

    @Test
    @DisplayName("a failed witness leaves the sandbox halted in both directions")
    void failsClosed() {
        when(auditLog.witness(eq(AuditEventKind.EMERGENCY_STOP_TRIGGERED), any(), anyMap(), any()))
                .thenThrow(new SandboxException(ErrorKind.LATENCY_CAP_EXCEEDED, "slow"));
        assertThatThrownBy(() -> emergencyStop.trigger("operator", "drill")).isInstanceOf(SandboxException.class);
        assertThat(emergencyStop.isHalted()).isTrue();

        when(auditLog.witness(eq(AuditEventKind.EMERGENCY_STOP_CLEARED), any(), anyMap(), any()))
                .thenThrow(new SandboxException(ErrorKind.LATENCY_CAP_EXCEEDED, "slow"));
        assertThatThrownBy(() -> emergencyStop.clear("operator", "done")).isInstanceOf(SandboxException.class);
        assertThat(emergencyStop.isHalted()).isTrue();
        verify(auditLog, never()).witness(eq(AuditEventKind.COMPLIANCE_VIOLATION), any(), anyMap(), any());
    }
}
