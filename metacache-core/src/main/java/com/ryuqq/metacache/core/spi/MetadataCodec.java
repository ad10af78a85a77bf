package com.ryuqq.metacache.core.spi;

import com.ryuqq.metacache.core.exception.MetadataSerializationException;

/**
 * 메타데이터 직렬화 SPI.
 *
 * <p>메타데이터 타입마다 하나의 codec을 제공합니다. 디스크 계층은 이 codec으로
 * 인코딩한 바이트를 그대로 저장하며, 포맷 버전 관리는 하지 않습니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>{@code decode(encode(m))}는 {@code m}과 같은 값이어야 함</li>
 *   <li>실패는 {@link MetadataSerializationException}으로 보고</li>
 *   <li>thread-safe (I/O 스레드와 호출자 스레드에서 동시에 사용됨)</li>
 * </ul>
 *
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MetadataCodec<M> {

    /**
     * 메타데이터를 바이트로 인코딩.
     *
     * @param metadata 메타데이터
     * @return 인코딩된 바이트
     * @throws MetadataSerializationException 인코딩 실패 시
     */
    byte[] encode(M metadata);

    /**
     * 바이트를 메타데이터로 디코딩.
     *
     * @param bytes 저장된 바이트
     * @return 메타데이터
     * @throws MetadataSerializationException 디코딩 실패 시
     */
    M decode(byte[] bytes);
}
