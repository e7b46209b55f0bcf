package com.library.circulation.unit.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.library.circulation.dto.response.AdminActionResponse;
import com.library.circulation.entity.AdminAction;
import com.library.circulation.repository.AdminActionRepository;
import com.library.circulation.service.AdminActionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdminActionServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private AdminActionRepository adminActionRepository;

    private AdminActionService adminActionService;

    @BeforeEach
    void setUp() {
        adminActionService = new AdminActionService(adminActionRepository, new ObjectMapper(),
                                                     Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void record_persistsActionWithJsonDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("studentName", "Chidi Eze");
        details.put("previousBlacklistUntil", null);

        adminActionService.record("admin-1", AdminAction.ACTION_UNBLACKLIST, AdminAction.TARGET_STUDENT, "5", details);

        ArgumentCaptor<AdminAction> captor = ArgumentCaptor.forClass(AdminAction.class);
        verify(adminActionRepository).save(captor.capture());
        AdminAction saved = captor.getValue();
        assertThat(saved.getAdminId()).isEqualTo("admin-1");
        assertThat(saved.getActionType()).isEqualTo("unblacklist");
        assertThat(saved.getTargetType()).isEqualTo("student");
        assertThat(saved.getTargetId()).isEqualTo("5");
        assertThat(saved.getCreatedAt()).isEqualTo(NOW);
        assertThat(saved.getDetails()).isEqualTo("{\"studentName\":\"Chidi Eze\",\"previousBlacklistUntil\":null}");
    }

    @Test
    void findAll_withTarget_filtersByTarget() {
        Pageable pageable = PageRequest.of(0, 10);
        when(adminActionRepository.findAllByTargetTypeAndTargetId("student", "5", pageable))
            .thenReturn(new PageImpl<>(List.of(new AdminAction())));

        Page<AdminActionResponse> result = adminActionService.findAll("student", "5", pageable);

        assertThat(result.getContent()).hasSize(1);
        verify(adminActionRepository, never()).findAll(any(Pageable.class));
    }

    @Test
    void findAll_withoutTarget_returnsEverything() {
        Pageable pageable = PageRequest.of(0, 10);
        when(adminActionRepository.findAll(pageable)).thenReturn(new PageImpl<>(List.of()));

        Page<AdminActionResponse> result = adminActionService.findAll(null, null, pageable);

        assertThat(result.getContent()).isEmpty();
    }

    @Test
    void findAll_withOnlyOneHalfOfTarget_isRejected() {
        Pageable pageable = PageRequest.of(0, 20);

        assertThatThrownBy(() -> adminActionService.findAll("student", null, pageable))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("together");
        assertThatThrownBy(() -> adminActionService.findAll(null, "5", pageable))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(adminActionRepository);
    }
}
