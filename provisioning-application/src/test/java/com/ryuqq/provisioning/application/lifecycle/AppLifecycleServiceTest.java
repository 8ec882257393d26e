package com.ryuqq.provisioning.application.lifecycle;

import com.ryuqq.provisioning.core.event.AppActivated;
import com.ryuqq.provisioning.core.event.AppCreated;
import com.ryuqq.provisioning.core.event.AppDeleted;
import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.event.BuildRequested;
import com.ryuqq.provisioning.core.event.ExistingInfrastructureSelected;
import com.ryuqq.provisioning.core.model.AppId;
import com.ryuqq.provisioning.core.model.AppSnapshot;
import com.ryuqq.provisioning.core.model.AppStatus;
import com.ryuqq.provisioning.core.model.AwsRegion;
import com.ryuqq.provisioning.core.model.Infrastructure;
import com.ryuqq.provisioning.core.model.InfrastructureChoice;
import com.ryuqq.provisioning.core.model.InfrastructureProvider;
import com.ryuqq.provisioning.core.spi.AppStore;
import com.ryuqq.provisioning.core.spi.AppendResult;
import com.ryuqq.provisioning.core.spi.ProvisioningPublisher;
import com.ryuqq.provisioning.core.typestate.ActiveApp;
import com.ryuqq.provisioning.core.typestate.CorruptedApp;
import com.ryuqq.provisioning.core.typestate.DeletedApp;
import com.ryuqq.provisioning.core.typestate.NewApp;
import com.ryuqq.provisioning.core.typestate.NotActivatedApp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * AppLifecycleService 유닛 테스트.
 *
 * <ul>
 *   <li>load → reconstruct → 연산 → append → publish 흐름</li>
 *   <li>변형이 연산을 노출하지 않으면 APP-422</li>
 *   <li>낙관적 충돌은 CommandResult.Conflict</li>
 *   <li>발행 실패는 결과를 바꾸지 않음</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AppLifecycleServiceTest {

    private static final AppId UUID = AppId.of("u1");
    private static final InfrastructureChoice AWS_US_EAST = InfrastructureChoice.aws(AwsRegion.of("us-east-1"));

    @Mock
    private AppStore store;

    @Mock
    private ProvisioningPublisher publisher;

    private AppLifecycleService service;

    @BeforeEach
    void setUp() {
        service = new AppLifecycleService(store, publisher, new AppLifecycleConfig());
    }

    private void givenStored(AppStatus status, Infrastructure infrastructure, long version) {
        when(store.load(UUID)).thenReturn(Optional.of(new AppSnapshot(UUID, status, infrastructure, version)));
    }

    // ============================================================
    // create
    // ============================================================

    @Test
    void create_없는_App이면_AppCreated_저장() {
        // given
        when(store.load(UUID)).thenReturn(Optional.empty());
        when(store.appendEvents(UUID, List.of(new AppCreated(UUID)), 0)).thenReturn(new AppendResult.Appended(1));

        // when
        CommandResult result = service.create(UUID);

        // then
        assertThat(result).isInstanceOf(CommandResult.Applied.class);
        CommandResult.Applied applied = (CommandResult.Applied) result;
        assertThat(applied.app()).isInstanceOf(NewApp.class);
        assertThat(applied.appended()).containsExactly(new AppCreated(UUID));
        verifyNoInteractions(publisher);
    }

    @Test
    void create_이미_존재하면_APP_409() {
        // given
        givenStored(AppStatus.DELETED, Infrastructure.notSelected(), 2);

        // when
        CommandResult result = service.create(UUID);

        // then
        assertThat(result).isInstanceOf(CommandResult.Rejected.class);
        assertThat(((CommandResult.Rejected) result).errorCode()).isEqualTo(CommandResult.ALREADY_EXISTS);
        verify(store, never()).appendEvents(any(), anyList(), anyLong());
    }

    // ============================================================
    // selectInfrastructure
    // ============================================================

    @Test
    void selectInfrastructure_빌드_자동요청_켜면_두_이벤트_저장_및_발행() {
        // given
        service = new AppLifecycleService(store, publisher,
            new AppLifecycleConfig().withRequestBuildOnSelection(true));
        givenStored(AppStatus.NEW, Infrastructure.notSelected(), 1);
        List<AppDomainEvent> expected = List.of(
            new ExistingInfrastructureSelected(UUID, AWS_US_EAST),
            new BuildRequested(UUID, AWS_US_EAST)
        );
        when(store.appendEvents(UUID, expected, 1)).thenReturn(new AppendResult.Appended(3));

        // when
        CommandResult result = service.selectInfrastructure(UUID, AWS_US_EAST);

        // then
        assertThat(result).isInstanceOf(CommandResult.Applied.class);
        CommandResult.Applied applied = (CommandResult.Applied) result;
        assertThat(applied.app()).isInstanceOf(NotActivatedApp.class);
        assertThat(applied.app().snapshot().version()).isEqualTo(3);
        assertThat(applied.appended()).isEqualTo(expected);
        assertThat(applied.app().events()).containsExactly(expected.get(1));
        verify(publisher).publish(expected.get(0));
        verify(publisher).publish(expected.get(1));
    }

    @Test
    void selectInfrastructure_기본_설정이면_선택_이벤트_하나만_저장() {
        // given
        givenStored(AppStatus.NEW, Infrastructure.notSelected(), 1);
        ExistingInfrastructureSelected selected = new ExistingInfrastructureSelected(UUID, InfrastructureChoice.azure());
        when(store.appendEvents(UUID, List.of(selected), 1)).thenReturn(new AppendResult.Appended(2));

        // when
        CommandResult result = service.selectInfrastructure(UUID, InfrastructureChoice.azure());

        // then
        CommandResult.Applied applied = (CommandResult.Applied) result;
        assertThat(applied.appended()).containsExactly(selected);
        assertThat(applied.app().events()).isEqualTo(applied.appended());
        assertThat(applied.app().snapshot().version()).isEqualTo(2);
        verify(publisher).publish(selected);
        verifyNoMoreInteractions(publisher);
    }

    @Test
    void selectInfrastructure_발행_끄면_publisher_호출_안함() {
        // given
        service = new AppLifecycleService(store, publisher,
            new AppLifecycleConfig().withPublishProvisioningEvents(false));
        givenStored(AppStatus.NEW, Infrastructure.notSelected(), 1);
        when(store.appendEvents(eq(UUID), anyList(), eq(1L))).thenReturn(new AppendResult.Appended(2));

        // when
        CommandResult result = service.selectInfrastructure(UUID, AWS_US_EAST);

        // then
        assertThat(result).isInstanceOf(CommandResult.Applied.class);
        verifyNoInteractions(publisher);
    }

    @Test
    void selectInfrastructure_이미_선택됐으면_APP_422() {
        // given
        givenStored(AppStatus.NEW, Infrastructure.selected(InfrastructureProvider.AWS), 2);

        // when
        CommandResult result = service.selectInfrastructure(UUID, AWS_US_EAST);

        // then
        assertThat(result).isInstanceOf(CommandResult.Rejected.class);
        assertThat(((CommandResult.Rejected) result).errorCode()).isEqualTo(CommandResult.NOT_AVAILABLE);
        verify(store, never()).appendEvents(any(), anyList(), anyLong());
    }

    @Test
    void selectInfrastructure_없는_App이면_APP_404() {
        // given
        when(store.load(UUID)).thenReturn(Optional.empty());

        // when
        CommandResult result = service.selectInfrastructure(UUID, AWS_US_EAST);

        // then
        assertThat(((CommandResult.Rejected) result).errorCode()).isEqualTo(CommandResult.NOT_FOUND);
    }

    @Test
    void selectInfrastructure_null_인프라는_예외() {
        assertThatThrownBy(() -> service.selectInfrastructure(UUID, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // requestBuild
    // ============================================================

    @Test
    void requestBuild_제공자_불일치면_APP_400() {
        // given
        givenStored(AppStatus.NEW, Infrastructure.selected(InfrastructureProvider.AWS), 2);

        // when
        CommandResult result = service.requestBuild(UUID, InfrastructureChoice.azure());

        // then
        assertThat(((CommandResult.Rejected) result).errorCode()).isEqualTo(CommandResult.INVALID_ARGUMENT);
        verify(store, never()).appendEvents(any(), anyList(), anyLong());
    }

    @Test
    void requestBuild_선택된_제공자면_BuildRequested_저장() {
        // given
        givenStored(AppStatus.NEW, Infrastructure.selected(InfrastructureProvider.AWS), 2);
        BuildRequested event = new BuildRequested(UUID, AWS_US_EAST);
        when(store.appendEvents(UUID, List.of(event), 2)).thenReturn(new AppendResult.Appended(3));

        // when
        CommandResult result = service.requestBuild(UUID, AWS_US_EAST);

        // then
        assertThat(((CommandResult.Applied) result).appended()).containsExactly(event);
        verify(publisher).publish(event);
    }

    // ============================================================
    // activate / delete
    // ============================================================

    @Test
    void activate_NotActivated면_ActiveApp_반환_발행_없음() {
        // given
        givenStored(AppStatus.NEW, Infrastructure.selected(InfrastructureProvider.AZURE), 3);
        when(store.appendEvents(UUID, List.of(new AppActivated(UUID)), 3)).thenReturn(new AppendResult.Appended(4));

        // when
        CommandResult result = service.activate(UUID);

        // then
        assertThat(((CommandResult.Applied) result).app()).isInstanceOf(ActiveApp.class);
        verifyNoInteractions(publisher);
    }

    @Test
    void activate_인프라_미선택이면_APP_422() {
        givenStored(AppStatus.NEW, Infrastructure.notSelected(), 1);

        CommandResult result = service.activate(UUID);

        assertThat(((CommandResult.Rejected) result).errorCode()).isEqualTo(CommandResult.NOT_AVAILABLE);
    }

    @Test
    void delete_Active면_DeletedApp_반환() {
        // given
        givenStored(AppStatus.ACTIVE, Infrastructure.selected(InfrastructureProvider.AWS), 4);
        when(store.appendEvents(UUID, List.of(new AppDeleted(UUID)), 4)).thenReturn(new AppendResult.Appended(5));

        // when
        CommandResult result = service.delete(UUID);

        // then
        CommandResult.Applied applied = (CommandResult.Applied) result;
        assertThat(applied.app()).isInstanceOf(DeletedApp.class);
        assertThat(applied.app().snapshot().infrastructure()).isEqualTo(Infrastructure.selected(InfrastructureProvider.AWS));
    }

    @Test
    void delete_이미_삭제됐으면_APP_422() {
        givenStored(AppStatus.DELETED, Infrastructure.notSelected(), 2);

        CommandResult result = service.delete(UUID);

        assertThat(((CommandResult.Rejected) result).errorCode()).isEqualTo(CommandResult.NOT_AVAILABLE);
        verify(store, never()).appendEvents(any(), anyList(), anyLong());
    }

    @Test
    void delete_불변식_위반_스냅샷은_Corrupted로_APP_422() {
        // given: ACTIVE without infrastructure
        givenStored(AppStatus.ACTIVE, Infrastructure.notSelected(), 2);

        // when
        CommandResult result = service.delete(UUID);

        // then
        assertThat(((CommandResult.Rejected) result).errorCode()).isEqualTo(CommandResult.NOT_AVAILABLE);
        assertThat(service.find(UUID).orElseThrow()).isInstanceOf(CorruptedApp.class);
    }

    // ============================================================
    // 충돌 / 발행 실패
    // ============================================================

    @Test
    void activate_버전_충돌이면_Conflict_반환() {
        // given
        givenStored(AppStatus.NEW, Infrastructure.selected(InfrastructureProvider.AWS), 2);
        when(store.appendEvents(UUID, List.of(new AppActivated(UUID)), 2)).thenReturn(new AppendResult.Conflict(2, 3));

        // when
        CommandResult result = service.activate(UUID);

        // then
        assertThat(result).isEqualTo(new CommandResult.Conflict(UUID, 2, 3));
    }

    @Test
    void selectInfrastructure_발행_실패해도_Applied_반환_및_나머지_발행_계속() {
        // given
        service = new AppLifecycleService(store, publisher,
            new AppLifecycleConfig().withRequestBuildOnSelection(true));
        givenStored(AppStatus.NEW, Infrastructure.notSelected(), 1);
        when(store.appendEvents(eq(UUID), anyList(), eq(1L))).thenReturn(new AppendResult.Appended(3));
        doThrow(new IllegalStateException("broker down"))
            .doNothing()
            .when(publisher).publish(any());

        // when
        CommandResult result = service.selectInfrastructure(UUID, AWS_US_EAST);

        // then
        assertThat(result).isInstanceOf(CommandResult.Applied.class);
        verify(publisher).publish(new BuildRequested(UUID, AWS_US_EAST));
    }

    @Test
    void config_기본값은_빌드_자동요청_꺼짐_발행_켜짐() {
        AppLifecycleConfig config = new AppLifecycleConfig();

        assertThat(config.requestBuildOnSelection()).isFalse();
        assertThat(config.publishProvisioningEvents()).isTrue();
    }

    @Test
    void constructor_null_의존성은_예외() {
        assertThatThrownBy(() -> new AppLifecycleService(null, publisher, new AppLifecycleConfig()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AppLifecycleService(store, publisher, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
