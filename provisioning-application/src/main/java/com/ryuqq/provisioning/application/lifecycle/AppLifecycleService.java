package com.ryuqq.provisioning.application.lifecycle;

import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.model.AppId;
import com.ryuqq.provisioning.core.model.AppSnapshot;
import com.ryuqq.provisioning.core.model.InfrastructureChoice;
import com.ryuqq.provisioning.core.spi.AppStore;
import com.ryuqq.provisioning.core.spi.AppendResult;
import com.ryuqq.provisioning.core.spi.ProvisioningPublisher;
import com.ryuqq.provisioning.core.typestate.ActiveApp;
import com.ryuqq.provisioning.core.typestate.App;
import com.ryuqq.provisioning.core.typestate.AppReconstructor;
import com.ryuqq.provisioning.core.typestate.CorruptedApp;
import com.ryuqq.provisioning.core.typestate.DeletedApp;
import com.ryuqq.provisioning.core.typestate.NewApp;
import com.ryuqq.provisioning.core.typestate.NotActivatedApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * App 명령 조정자.
 *
 * <p>외부 명령을 받아 Typestate 코어와 SPI를 연결하는 얇은 계층입니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. store.load(uuid)                      → AppSnapshot (version = N)
 * 2. AppReconstructor.fromPersisted()      → App 변형
 * 3. 연산을 노출하는 변형으로 좁히기 (instanceof)
 *    - 아니면 → Rejected(APP-422)
 * 4. 연산 호출                              → 새 변형 + 이벤트
 * 5. store.appendEvents(uuid, events, N)
 *    - Conflict → CommandResult.Conflict
 * 6. 프로비저닝 이벤트 발행 (fire-and-forget)
 * 7. Applied(app, events)
 * </pre>
 *
 * <p><strong>예외 정책:</strong></p>
 * <ul>
 *   <li>도메인 거부와 동시성 충돌은 {@link CommandResult}로 반환</li>
 *   <li>발행 실패는 로그만 남기고 결과를 바꾸지 않음 (이미 저장됨)</li>
 *   <li>저장소 장애는 호출자에게 전파</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class AppLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(AppLifecycleService.class);
    private final AppStore store;
    private final ProvisioningPublisher publisher;
    private final AppLifecycleConfig config;

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param publisher 프로비저닝 발행자
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AppLifecycleService(AppStore store, ProvisioningPublisher publisher, AppLifecycleConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.publisher = publisher;
        this.config = config;
    }

    /**
     * 현재 App 조회.
     *
     * @param uuid App ID
     * @return 복원된 변형, 없으면 empty
     * @throws IllegalArgumentException uuid가 null인 경우
     */
    public Optional<App> find(AppId uuid) {
        if (uuid == null) {
            throw new IllegalArgumentException("uuid cannot be null");
        }
        return store.load(uuid).map(this::reconstruct);
    }

    /**
     * App 생성.
     *
     * @param uuid App ID
     * @return Applied(NewApp) 또는 Rejected(APP-409) 또는 Conflict
     */
    public CommandResult create(AppId uuid) {
        if (find(uuid).isPresent()) {
            return reject(CommandResult.ALREADY_EXISTS, "create", "App already exists: " + uuid);
        }
        NewApp created = App.create(uuid);
        return commit("create", created, created.events(), 0);
    }

    /**
     * 기존 인프라 선택.
     *
     * <p>기본 설정에서는 ExistingInfrastructureSelected 하나만 저장합니다.
     * {@link AppLifecycleConfig#requestBuildOnSelection()}이 true이면 같은 인프라에 대한
     * 빌드 요청 이벤트도 함께 저장합니다.</p>
     *
     * @param uuid App ID
     * @param infrastructure 선택할 인프라
     * @return 명령 결과
     * @throws IllegalArgumentException infrastructure가 null인 경우
     */
    public CommandResult selectInfrastructure(AppId uuid, InfrastructureChoice infrastructure) {
        if (infrastructure == null) {
            throw new IllegalArgumentException("infrastructure cannot be null");
        }
        Optional<App> loaded = find(uuid);
        if (loaded.isEmpty()) {
            return notFound("selectInfrastructure", uuid);
        }
        App app = loaded.get();
        if (!(app instanceof NewApp newApp)) {
            return notAvailable("selectInfrastructure", app);
        }

        NotActivatedApp selected = newApp.selectInfrastructure(infrastructure);
        List<AppDomainEvent> events = new ArrayList<>(selected.events());
        NotActivatedApp result = selected;
        if (config.requestBuildOnSelection()) {
            result = selected.requestBuild(infrastructure);
            events.addAll(result.events());
        }
        return commit("selectInfrastructure", result, events, app.snapshot().version());
    }

    /**
     * 선택된 인프라에 대한 빌드 요청.
     *
     * @param uuid App ID
     * @param infrastructure 빌드 대상 인프라
     * @return 명령 결과 (제공자가 선택된 것과 다르면 Rejected(APP-400))
     * @throws IllegalArgumentException infrastructure가 null인 경우
     */
    public CommandResult requestBuild(AppId uuid, InfrastructureChoice infrastructure) {
        if (infrastructure == null) {
            throw new IllegalArgumentException("infrastructure cannot be null");
        }
        Optional<App> loaded = find(uuid);
        if (loaded.isEmpty()) {
            return notFound("requestBuild", uuid);
        }
        App app = loaded.get();
        if (!(app instanceof NotActivatedApp notActivated)) {
            return notAvailable("requestBuild", app);
        }
        if (notActivated.provider() != infrastructure.provider()) {
            return reject(CommandResult.INVALID_ARGUMENT, "requestBuild",
                String.format("Build target %s does not match selected provider %s for %s",
                    infrastructure.provider(), notActivated.provider(), uuid));
        }

        NotActivatedApp result = notActivated.requestBuild(infrastructure);
        return commit("requestBuild", result, result.events(), app.snapshot().version());
    }

    /**
     * 활성화.
     *
     * @param uuid App ID
     * @return 명령 결과
     */
    public CommandResult activate(AppId uuid) {
        Optional<App> loaded = find(uuid);
        if (loaded.isEmpty()) {
            return notFound("activate", uuid);
        }
        App app = loaded.get();
        if (!(app instanceof NotActivatedApp notActivated)) {
            return notAvailable("activate", app);
        }

        ActiveApp result = notActivated.activate();
        return commit("activate", result, result.events(), app.snapshot().version());
    }

    /**
     * 삭제.
     *
     * <p>NewApp, NotActivatedApp, ActiveApp에서만 가능합니다.
     * 이미 삭제된 App은 APP-422로 거부됩니다.</p>
     *
     * @param uuid App ID
     * @return 명령 결과
     */
    public CommandResult delete(AppId uuid) {
        Optional<App> loaded = find(uuid);
        if (loaded.isEmpty()) {
            return notFound("delete", uuid);
        }
        App app = loaded.get();

        DeletedApp result;
        if (app instanceof NewApp newApp) {
            result = newApp.delete();
        } else if (app instanceof NotActivatedApp notActivated) {
            result = notActivated.delete();
        } else if (app instanceof ActiveApp active) {
            result = active.delete();
        } else {
            return notAvailable("delete", app);
        }
        return commit("delete", result, result.events(), app.snapshot().version());
    }

    private App reconstruct(AppSnapshot snapshot) {
        App app = AppReconstructor.fromPersisted(snapshot);
        if (app instanceof CorruptedApp && snapshot.status() != app.status()) {
            log.warn("Persisted snapshot violates invariant, treating {} as CORRUPTED: {}", snapshot.uuid(), snapshot);
        }
        return app;
    }

    private CommandResult commit(String command, App result, List<AppDomainEvent> events, long expectedVersion) {
        AppendResult appendResult = store.appendEvents(result.uuid(), events, expectedVersion);

        if (appendResult instanceof AppendResult.Conflict conflict) {
            log.warn("{} on {} lost optimistic race: expected version {}, actual {}",
                command, result.uuid(), conflict.expectedVersion(), conflict.actualVersion());
            return new CommandResult.Conflict(result.uuid(), conflict.expectedVersion(), conflict.actualVersion());
        }

        AppendResult.Appended appended = (AppendResult.Appended) appendResult;
        log.info("{} applied to {}: {} → version {}", command, result.uuid(), result.kind(), appended.newVersion());

        if (config.publishProvisioningEvents()) {
            publishProvisioningEvents(events);
        }
        return new CommandResult.Applied(result, events);
    }

    private void publishProvisioningEvents(List<AppDomainEvent> events) {
        for (AppDomainEvent event : events) {
            if (!event.type().isProvisioningSignal()) {
                continue;
            }
            try {
                publisher.publish(event);
            } catch (RuntimeException e) {
                // events are already stored; the provisioning side picks them up from the log
                log.error("Failed to publish {} for {}", event.type(), event.uuid(), e);
            }
        }
    }

    private CommandResult notFound(String command, AppId uuid) {
        return reject(CommandResult.NOT_FOUND, command, "App not found: " + uuid);
    }

    private CommandResult notAvailable(String command, App app) {
        return reject(CommandResult.NOT_AVAILABLE, command,
            String.format("%s is not available for %s app %s", command, app.kind(), app.uuid()));
    }

    private CommandResult reject(String errorCode, String command, String message) {
        log.warn("{} rejected [{}]: {}", command, errorCode, message);
        return new CommandResult.Rejected(errorCode, message);
    }
}
