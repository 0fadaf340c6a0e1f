package com.jijue.hospital_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.jijue.hospital_api.dto.LabRequestUpdate;
import com.jijue.hospital_api.model.LabRequest;
import com.jijue.hospital_api.model.LabRequestStatus;
import com.jijue.hospital_api.repository.LabRequestRepository;

@ExtendWith(MockitoExtension.class)
class LabRequestServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-10T05:00:00Z");

    @Mock
    private LabRequestRepository labRequestRepository;

    private LabRequestService labRequestService;

    @BeforeEach
    void setUp() {
        labRequestService = new LabRequestService(labRequestRepository, Clock.fixed(NOW, ZoneId.of("Africa/Nairobi")));
    }

    private LabRequest stored() {
        LabRequest labRequest = new LabRequest("PAT123456789", "Full blood count");
        labRequest.setId("lab-1");
        when(labRequestRepository.findById("lab-1")).thenReturn(Optional.of(labRequest));
        when(labRequestRepository.save(labRequest)).thenReturn(labRequest);
        return labRequest;
    }

    @Test
    void completingARequestStampsCompletedDateAndResults() {
        stored();

        LabRequest updated = labRequestService.updateLabRequest("lab-1", new LabRequestUpdate("completed", "Hb 13.5 g/dL"));

        assertThat(updated.getStatus()).isEqualTo(LabRequestStatus.COMPLETED);
        assertThat(updated.getCompletedDate()).isEqualTo(NOW);
        assertThat(updated.getResults()).isEqualTo("Hb 13.5 g/dL");
        assertThat(updated.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void otherTransitionsLeaveCompletedDateUnset() {
        stored();

        LabRequest updated = labRequestService.updateLabRequest("lab-1", new LabRequestUpdate("in-progress", null));

        assertThat(updated.getStatus()).isEqualTo(LabRequestStatus.IN_PROGRESS);
        assertThat(updated.getCompletedDate()).isNull();
        assertThat(updated.getResults()).isNull();
    }

    @Test
    void statusIsRequired() {
        assertThatThrownBy(() -> labRequestService.updateLabRequest("lab-1", new LabRequestUpdate(" ", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Status is required");
        verify(labRequestRepository, never()).save(any());
    }
}
