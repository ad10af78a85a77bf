/**
 * 콜백 전달 컨텍스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.metacache.core.executor;
