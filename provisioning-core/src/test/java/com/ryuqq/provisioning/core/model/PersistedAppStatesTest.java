package com.ryuqq.provisioning.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 평면 영속 레이아웃 매핑 테스트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class PersistedAppStatesTest {

    private static final AppId UUID = AppId.of("u1");

    @Test
    void fromSnapshot_Selected_WritesProviderColumn() {
        // Given
        AppSnapshot snapshot = new AppSnapshot(UUID, AppStatus.ACTIVE,
            Infrastructure.selected(InfrastructureProvider.AWS), 3);

        // When
        PersistedAppState row = PersistedAppStates.fromSnapshot(snapshot);

        // Then
        assertThat(row).isEqualTo(new PersistedAppState(
            "u1", AppStatus.ACTIVE, InfrastructureStatus.SELECTED, InfrastructureProvider.AWS, 3));
    }

    @Test
    void fromSnapshot_NotSelected_LeavesProviderNull() {
        PersistedAppState row = PersistedAppStates.fromSnapshot(AppSnapshot.created(UUID));

        assertThat(row.infrastructureStatus()).isEqualTo(InfrastructureStatus.NOT_SELECTED);
        assertThat(row.infrastructureProvider()).isNull();
        assertThat(row.version()).isEqualTo(1);
    }

    @Test
    void toSnapshot_ConsistentRow_RoundTrips() {
        AppSnapshot snapshot = new AppSnapshot(UUID, AppStatus.DELETED,
            Infrastructure.selected(InfrastructureProvider.AZURE), 5);

        assertThat(PersistedAppStates.toSnapshot(PersistedAppStates.fromSnapshot(snapshot)))
            .isEqualTo(snapshot);
    }

    @Test
    void toSnapshot_SelectedWithoutProvider_IsCorrupted() {
        PersistedAppState row = new PersistedAppState("u1", AppStatus.NEW, InfrastructureStatus.SELECTED, null, 2);

        AppSnapshot snapshot = PersistedAppStates.toSnapshot(row);

        assertThat(snapshot).isEqualTo(new AppSnapshot(UUID, AppStatus.CORRUPTED, Infrastructure.notSelected(), 2));
    }

    @Test
    void toSnapshot_NewNotSelectedWithStrayProvider_IgnoresProvider() {
        // Given: selection flag says NOT_SELECTED, provider column left over
        PersistedAppState row = new PersistedAppState(
            "u1", AppStatus.NEW, InfrastructureStatus.NOT_SELECTED, InfrastructureProvider.AWS, 1);

        // When
        AppSnapshot snapshot = PersistedAppStates.toSnapshot(row);

        // Then
        assertThat(snapshot).isEqualTo(new AppSnapshot(UUID, AppStatus.NEW, Infrastructure.notSelected(), 1));
    }

    @Test
    void toSnapshot_DeletedNotSelectedWithStrayProvider_IgnoresProvider() {
        PersistedAppState row = new PersistedAppState(
            "u1", AppStatus.DELETED, InfrastructureStatus.NOT_SELECTED, InfrastructureProvider.AZURE, 4);

        assertThat(PersistedAppStates.toSnapshot(row))
            .isEqualTo(new AppSnapshot(UUID, AppStatus.DELETED, Infrastructure.notSelected(), 4));
    }

    @Test
    void toSnapshot_ActiveNotSelectedWithStrayProvider_KeepsActiveAndViolatesInvariant() {
        PersistedAppState row = new PersistedAppState(
            "u1", AppStatus.ACTIVE, InfrastructureStatus.NOT_SELECTED, InfrastructureProvider.AWS, 4);

        AppSnapshot snapshot = PersistedAppStates.toSnapshot(row);

        assertThat(snapshot.status()).isEqualTo(AppStatus.ACTIVE);
        assertThat(snapshot.satisfiesInvariant()).isFalse();
    }

    @Test
    void toSnapshot_Null_ThrowsException() {
        assertThatThrownBy(() -> PersistedAppStates.toSnapshot(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void snapshot_ActiveWithoutInfrastructure_ViolatesInvariant() {
        AppSnapshot snapshot = new AppSnapshot(UUID, AppStatus.ACTIVE, Infrastructure.notSelected(), 2);

        assertThat(snapshot.satisfiesInvariant()).isFalse();
        assertThat(snapshot.withStatus(AppStatus.CORRUPTED).satisfiesInvariant()).isTrue();
    }
}
