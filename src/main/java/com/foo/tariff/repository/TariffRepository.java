package com.foo.tariff.repository;

import com.foo.tariff.config.TariffEngineProperties;
import com.foo.tariff.exception.InvalidScheduleException;
import com.foo.tariff.exception.TariffNotFoundException;
import com.foo.tariff.model.TariffSchedule;
import com.foo.tariff.validation.ScheduleIntegrityValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 게시된 요율표 스냅샷 저장소.
 *
 * <p>현재 상태는 불변 {@link ScheduleIndex} 하나이며 {@link AtomicReference}로 교체된다. 조회는 잠금 없이 현재
 * 인덱스를 읽고, 게시만 {@code publishLock}으로 직렬화한다. 조회자는 받은 스냅샷을 요청이 끝날 때까지 그대로 쓴다.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class TariffRepository {

    private final ScheduleIntegrityValidator integrityValidator;
    private final TariffEngineProperties properties;

    private final AtomicReference<ScheduleIndex> current =
            new AtomicReference<>(ScheduleIndex.EMPTY);
    private final ReentrantLock publishLock = new ReentrantLock();

    /**
     * 항구에 적용할 스냅샷을 반환한다.
     *
     * @param version 고정할 버전. null이면 해당 항구의 최신 버전
     * @throws TariffNotFoundException 항구를 포함하는 스냅샷이 없을 때
     */
    public TariffSchedule getSnapshot(String port, Long version) {
        ScheduleIndex index = current.get();
        TariffSchedule schedule =
                version == null ? index.latestByPort().get(normalize(port)) : index.retained().get(version);
        if (schedule == null || !schedule.covers(port)) {
            throw new TariffNotFoundException(port, version);
        }
        return schedule;
    }

    public boolean isKnownPort(String port) {
        return port != null && current.get().latestByPort().containsKey(normalize(port));
    }

    /** 보관 중인 스냅샷을 버전 오름차순으로 반환한다. */
    public List<TariffSchedule> listSnapshots() {
        return List.copyOf(current.get().retained().values());
    }

    /**
     * 정합성 검사를 통과한 요율표에 새 버전을 부여하고 현재 인덱스를 교체한다.
     *
     * @return 부여된 버전
     * @throws InvalidScheduleException 정합성 검사 실패 시. 이 경우 현재 인덱스는 바뀌지 않는다.
     */
    public long publish(TariffSchedule draft) {
        List<String> problems = integrityValidator.check(draft);
        if (!problems.isEmpty()) {
            log.warn("요율표 게시 거부: label={}, problems={}", draft.label(), problems);
            throw InvalidScheduleException.integrity(problems);
        }

        publishLock.lock();
        try {
            ScheduleIndex previous = current.get();
            long version = previous.lastVersion() + 1;
            TariffSchedule published = draft.withPublication(version, Instant.now());

            Map<String, TariffSchedule> latestByPort = new HashMap<>(previous.latestByPort());
            published.ports().forEach(port -> latestByPort.put(normalize(port), published));

            NavigableMap<Long, TariffSchedule> retained = new TreeMap<>(previous.retained());
            retained.put(version, published);
            prune(retained, latestByPort);

            current.set(
                    new ScheduleIndex(
                            version,
                            Collections.unmodifiableMap(latestByPort),
                            Collections.unmodifiableNavigableMap(retained)));
            log.info(
                    "Published tariff schedule v{} ({}) for ports {}",
                    version,
                    published.label(),
                    published.ports());
            return version;
        } finally {
            publishLock.unlock();
        }
    }

    /** 어느 항구의 최신도 아닌 스냅샷은 보관 한도를 넘으면 오래된 것부터 인덱스에서 뺀다. */
    private void prune(
            NavigableMap<Long, TariffSchedule> retained, Map<String, TariffSchedule> latestByPort) {
        int limit = Math.max(0, properties.getRetainedVersions());
        List<Long> superseded =
                retained.values().stream()
                        .filter(s -> !latestByPort.containsValue(s))
                        .map(TariffSchedule::version)
                        .toList();
        for (int i = 0; i < superseded.size() - limit; i++) {
            retained.remove(superseded.get(i));
            log.debug("Dropped superseded schedule v{} from index", superseded.get(i));
        }
    }

    private static String normalize(String port) {
        return port.trim().toUpperCase();
    }

    private record ScheduleIndex(
            long lastVersion,
            Map<String, TariffSchedule> latestByPort,
            NavigableMap<Long, TariffSchedule> retained) {

        static final ScheduleIndex EMPTY =
                new ScheduleIndex(0, Map.of(), Collections.unmodifiableNavigableMap(new TreeMap<>()));
    }
}
