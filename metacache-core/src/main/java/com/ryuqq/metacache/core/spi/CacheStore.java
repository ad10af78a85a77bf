package com.ryuqq.metacache.core.spi;

import com.ryuqq.metacache.core.config.CacheQueryOption;
import com.ryuqq.metacache.core.model.CacheKey;
import com.ryuqq.metacache.core.model.CacheQueryResult;

import java.nio.file.Path;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 2계층(메모리 + 디스크) 캐시 SPI.
 *
 * <p><strong>계층 우선순위:</strong></p>
 * <ol>
 *   <li>메모리 계층을 동기로 먼저 조회</li>
 *   <li>메모리 hit이고 {@link CacheQueryOption#QUERY_DATA_WHEN_IN_MEMORY}가 없으면 즉시 반환</li>
 *   <li>그 외에는 디스크 단계 실행 (기본 비동기, {@link CacheQueryOption#QUERY_DISK_SYNC}면 동기)</li>
 *   <li>디스크 hit은 메모리 계층을 채운 뒤 전달</li>
 * </ol>
 *
 * <p><strong>콜백:</strong> 모든 비동기 콜백은 지정된 completion context에서 호출됩니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>메모리 계층 제거는 근사적이어도 됨 (엄격한 LRU 불필요)</li>
 *   <li>디스크 쓰기 실패는 로그만 남기고 호출자에게 전파하지 않음</li>
 *   <li>락을 잡은 채로 콜백이나 I/O를 호출하지 않음</li>
 * </ul>
 *
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CacheStore<M> {

    /**
     * 메타데이터 저장.
     *
     * <p>메모리 계층에는 동기로 기록하고, toDisk이면 디스크에는 비동기로 기록합니다.
     * 직렬화/쓰기 실패는 로그로만 남고 onDone은 그대로 호출됩니다.</p>
     *
     * @param key 캐시 키
     * @param metadata 메타데이터
     * @param toDisk 디스크 기록 여부
     * @param onDone 완료 콜백 (nullable)
     * @throws IllegalArgumentException key 또는 metadata가 null인 경우
     */
    void store(CacheKey key, M metadata, boolean toDisk, Runnable onDone);

    /**
     * 메모리와 디스크에 저장 (완료 콜백 없음).
     */
    default void store(CacheKey key, M metadata) {
        store(key, metadata, true, null);
    }

    /**
     * 디스크 존재 여부 동기 확인 (디코딩하지 않음).
     *
     * @param key 캐시 키
     * @return 디스크에 파일이 있으면 true
     */
    boolean diskExists(CacheKey key);

    /**
     * 디스크 존재 여부 비동기 확인.
     *
     * @param key 캐시 키
     * @param callback 결과 콜백 (completion context에서 호출)
     */
    void diskExists(CacheKey key, Consumer<Boolean> callback);

    /**
     * 계층 조회.
     *
     * @param key 캐시 키
     * @param options 조회 옵션 (null이면 설정의 기본 옵션)
     * @param callback 결과 콜백
     * @return 비동기 디스크 단계 취소 핸들, 디스크 단계가 없거나 동기로 끝났으면 null
     */
    Cancellable query(CacheKey key, Set<CacheQueryOption> options, Consumer<CacheQueryResult<M>> callback);

    /**
     * 메모리 계층 동기 조회.
     *
     * @return 메타데이터, 없으면 null
     */
    M fromMemory(CacheKey key);

    /**
     * 디스크 계층 동기 조회. hit이면 메모리 계층을 채웁니다.
     *
     * @return 메타데이터, 없거나 디코딩 실패 시 null
     */
    M fromDisk(CacheKey key);

    /**
     * 메모리 먼저, 없으면 디스크 조회.
     *
     * @return 메타데이터, 없으면 null
     */
    M fromEither(CacheKey key);

    /**
     * 메타데이터 제거.
     *
     * @param key 캐시 키
     * @param fromDisk 디스크에서도 제거할지 여부
     * @param onDone 완료 콜백 (nullable)
     */
    void remove(CacheKey key, boolean fromDisk, Runnable onDone);

    /**
     * 메모리 계층 전체 삭제.
     */
    void clearMemory();

    /**
     * 디스크 계층 전체 비동기 삭제.
     *
     * @param onDone 완료 콜백 (nullable)
     */
    void clearDisk(Runnable onDone);

    /**
     * 키에 대응하는 디스크 파일 경로.
     *
     * @param key 캐시 키
     * @return 파일 경로 (파일 존재 여부와 무관)
     */
    Path pathFor(CacheKey key);
}
