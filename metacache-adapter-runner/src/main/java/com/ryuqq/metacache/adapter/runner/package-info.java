/**
 * 로드 실행 어댑터.
 *
 * <h2>주요 구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.metacache.adapter.runner.OrderedWorkerPool} - FIFO/LIFO 준비 큐를 가진 고정 크기 풀</li>
 *   <li>{@link com.ryuqq.metacache.adapter.runner.BoundedLoadCoordinator} - 키당 1회 로드, 구독자 fan-out</li>
 *   <li>{@link com.ryuqq.metacache.adapter.runner.FunctionLoaderUnitFactory} - 조회 함수 어댑터</li>
 *   <li>{@link com.ryuqq.metacache.adapter.runner.MetadataCacheRuntime} - 전체 구성</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.metacache.adapter.runner;
