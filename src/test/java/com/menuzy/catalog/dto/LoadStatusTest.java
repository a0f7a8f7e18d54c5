package com.menuzy.catalog.dto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoadStatusTest {

    @Test
    @DisplayName("정상 경로: RECEIVED → VALIDATED → PERSISTING → COMMITTED")
    void transitionTo_HappyPath() {
        LoadStatus status = LoadStatus.RECEIVED
                .transitionTo(LoadStatus.VALIDATED)
                .transitionTo(LoadStatus.PERSISTING)
                .transitionTo(LoadStatus.COMMITTED);

        assertThat(status).isEqualTo(LoadStatus.COMMITTED);
        assertThat(status.isTerminal()).isTrue();
    }

    @Test
    @DisplayName("검증 실패는 VALIDATED에서만 REJECTED로 갈 수 있음")
    void canTransitionTo_Rejected() {
        assertThat(LoadStatus.VALIDATED.canTransitionTo(LoadStatus.REJECTED)).isTrue();
        assertThat(LoadStatus.RECEIVED.canTransitionTo(LoadStatus.REJECTED)).isFalse();
        assertThat(LoadStatus.PERSISTING.canTransitionTo(LoadStatus.REJECTED)).isFalse();
    }

    @Test
    @DisplayName("종료 전 모든 단계에서 ROLLED_BACK 가능")
    void canTransitionTo_RolledBack() {
        assertThat(LoadStatus.RECEIVED.canTransitionTo(LoadStatus.ROLLED_BACK)).isTrue();
        assertThat(LoadStatus.VALIDATED.canTransitionTo(LoadStatus.ROLLED_BACK)).isTrue();
        assertThat(LoadStatus.PERSISTING.canTransitionTo(LoadStatus.ROLLED_BACK)).isTrue();
    }

    @Test
    @DisplayName("종료 상태에서는 더 이상 전이 불가")
    void transitionTo_FromTerminal_Throws() {
        for (LoadStatus terminal : new LoadStatus[]{LoadStatus.COMMITTED, LoadStatus.REJECTED, LoadStatus.ROLLED_BACK}) {
            assertThat(terminal.isTerminal()).isTrue();
            assertThatThrownBy(() -> terminal.transitionTo(LoadStatus.RECEIVED))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining(terminal.name());
        }
    }

    @Test
    @DisplayName("검증을 건너뛰고 저장 단계로 갈 수 없음")
    void transitionTo_SkipValidation_Throws() {
        assertThatThrownBy(() -> LoadStatus.RECEIVED.transitionTo(LoadStatus.PERSISTING))
                .isInstanceOf(IllegalStateException.class);
    }
}
