package com.ryuqq.resilience.runner.bulkhead;

import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.time.AsyncSleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 이름 기반 Bulkhead 레지스트리.
 *
 * <p>같은 이름으로 다시 생성을 요청하면 기존 인스턴스를 반환합니다 (설정은 무시).
 * 여러 스레드에서 동시에 사용해도 안전합니다.</p>
 *
 * <p>프로세스 전역 인스턴스는 {@link #getDefault()}로 얻습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class BulkheadRegistry {

    private static final Logger log = LoggerFactory.getLogger(BulkheadRegistry.class);

    private static final class DefaultHolder {
        private static final BulkheadRegistry INSTANCE = new BulkheadRegistry();
    }

    private final ConcurrentHashMap<String, Bulkhead> bulkheads = new ConcurrentHashMap<>();
    private final BulkheadConfig defaultConfig;
    private final AsyncSleeper asyncSleeper;
    private final ResilienceEventListener eventListener;

    /**
     * 기본 설정으로 생성.
     */
    public BulkheadRegistry() {
        this(new BulkheadConfig(), AsyncSleeper.system(), ResilienceEventListener.noop());
    }

    /**
     * 생성자.
     *
     * @param defaultConfig 설정 없이 생성할 때 사용할 기본 설정
     * @param asyncSleeper 비동기 Pool의 시간 초과 예약용 Sleeper
     * @param eventListener 생성되는 Bulkhead/Pool에 연결할 이벤트 수신자
     */
    public BulkheadRegistry(
        BulkheadConfig defaultConfig,
        AsyncSleeper asyncSleeper,
        ResilienceEventListener eventListener
    ) {
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        if (asyncSleeper == null) {
            throw new IllegalArgumentException("asyncSleeper cannot be null");
        }
        this.defaultConfig = defaultConfig;
        this.asyncSleeper = asyncSleeper;
        this.eventListener = eventListener == null ? ResilienceEventListener.noop() : eventListener;
    }

    /**
     * 프로세스 전역 레지스트리.
     *
     * @return 전역 BulkheadRegistry
     */
    public static BulkheadRegistry getDefault() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * 기본 설정으로 Bulkhead 생성 (이미 있으면 기존 인스턴스).
     *
     * @param name 이름
     * @return Bulkhead
     */
    public Bulkhead create(String name) {
        return create(name, defaultConfig);
    }

    /**
     * Bulkhead 생성 (이미 있으면 기존 인스턴스).
     *
     * @param name 이름
     * @param config 설정 (이미 있는 이름이면 무시됨)
     * @return Bulkhead
     */
    public Bulkhead create(String name, BulkheadConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return bulkheads.computeIfAbsent(name, key -> {
            log.info("Bulkhead {} created: maxConcurrent={}, maxQueueSize={}, timeoutMs={}, async={}",
                key, config.maxConcurrent(), config.maxQueueSize(), config.timeoutMs(), config.asyncPool());
            return Bulkhead.of(key, config, asyncSleeper, eventListener);
        });
    }

    /**
     * 이름으로 조회.
     *
     * @param name 이름
     * @return Bulkhead (없으면 empty)
     */
    public Optional<Bulkhead> get(String name) {
        return Optional.ofNullable(name == null ? null : bulkheads.get(name));
    }

    /**
     * 등록된 이름 목록 (정렬됨).
     *
     * @return 이름 목록
     */
    public List<String> list() {
        List<String> names = new ArrayList<>(bulkheads.keySet());
        Collections.sort(names);
        return Collections.unmodifiableList(names);
    }

    /**
     * 등록 해제.
     *
     * <p>이미 얻어 간 Bulkhead 인스턴스는 계속 사용할 수 있습니다.</p>
     *
     * @param name 이름
     * @return 해제되었으면 true, 없는 이름이면 false
     */
    public boolean remove(String name) {
        return name != null && bulkheads.remove(name) != null;
    }

    /**
     * 모든 Bulkhead 상태 조회.
     *
     * @return 이름 순으로 정렬된 상태 맵
     */
    public Map<String, BulkheadStatus> getAllStatus() {
        Map<String, BulkheadStatus> statuses = new LinkedHashMap<>();
        for (String name : list()) {
            Bulkhead bulkhead = bulkheads.get(name);
            if (bulkhead != null) {
                statuses.put(name, bulkhead.getStatus());
            }
        }
        return Collections.unmodifiableMap(statuses);
    }
}
