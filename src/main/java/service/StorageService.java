package service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 키-값 저장소와 만료 시간 관리를 담당하는 서비스 클래스
 * <p>
 * 값과 만료 시간은 두 개의 맵에 있고, 이 객체의 모니터 안에서만 접근하므로
 * 키의 값과 만료 시간은 항상 함께 읽고 씁니다. 만료된 키는 읽을 때 삭제됩니다.
 */
public class StorageService {

    private final Map<String, String> keyValueStore = new HashMap<>();
    // 키별 만료 시간 (밀리초 단위 timestamp)
    private final Map<String, Long> keyExpiryStore = new HashMap<>();
    private final Clock clock;

    public StorageService() {
        this(Clock.systemUTC());
    }

    public StorageService(Clock clock) {
        this.clock = clock;
    }

    /**
     * 키-값을 저장합니다. 기존 만료 시간은 제거합니다.
     */
    public synchronized void set(String key, String value) {
        keyValueStore.put(key, value);
        keyExpiryStore.remove(key);
    }

    /**
     * 만료 시각(밀리초 timestamp)과 함께 키-값을 저장합니다.
     */
    public synchronized void setWithExpiry(String key, String value, long expiryTimeMs) {
        keyValueStore.put(key, value);
        keyExpiryStore.put(key, expiryTimeMs);
    }

    /**
     * 지금부터 {@code ttlMs} 밀리초 후에 만료되는 키-값을 저장합니다.
     */
    public synchronized void setWithTtl(String key, String value, long ttlMs) {
        setWithExpiry(key, value, saturatedAdd(clock.millis(), ttlMs));
    }

    /**
     * 살아 있는 키의 값을 반환합니다. 만료된 키는 먼저 삭제합니다.
     *
     * @return 값, 키가 없거나 만료되었으면 {@code null}
     */
    public synchronized String getLive(String key) {
        if (evictIfExpired(key, clock.millis())) {
            return null;
        }
        return keyValueStore.get(key);
    }

    /**
     * 살아 있는 모든 키를 반환합니다. 만료된 키들은 자동으로 정리됩니다.
     */
    public synchronized List<String> getLiveKeys() {
        long now = clock.millis();
        Iterator<Map.Entry<String, Long>> it = keyExpiryStore.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Long> entry = it.next();
            if (isExpired(entry.getValue(), now)) {
                keyValueStore.remove(entry.getKey());
                it.remove();
            }
        }
        return new ArrayList<>(keyValueStore.keySet());
    }

    /**
     * 만료 여부와 상관없이 두 맵 중 하나에 키가 있는지 확인합니다. 삭제하지 않습니다.
     */
    public synchronized boolean containsRaw(String key) {
        return keyValueStore.containsKey(key) || keyExpiryStore.containsKey(key);
    }

    /**
     * 키의 만료 시각, 만료 시간이 없으면 {@code null}. 삭제하지 않습니다.
     */
    public synchronized Long getExpiry(String key) {
        return keyExpiryStore.get(key);
    }

    /**
     * 살아 있는 키의 개수를 반환합니다.
     */
    public synchronized int size() {
        return getLiveKeys().size();
    }

    private boolean evictIfExpired(String key, long now) {
        Long expiryTime = keyExpiryStore.get(key);
        if (expiryTime == null || !isExpired(expiryTime, now)) {
            return false;
        }
        keyValueStore.remove(key);
        keyExpiryStore.remove(key);
        return true;
    }

    // 만료 시각이 현재보다 미래일 때만 살아 있음
    private static boolean isExpired(long expiryTimeMs, long now) {
        return now >= expiryTimeMs;
    }

    private static long saturatedAdd(long a, long b) {
        long result = a + b;
        if (((a ^ result) & (b ^ result)) < 0) {
            return b > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return result;
    }
}
