/**
 * LoaderUnit 및 요청 상태 머신.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.metacache.core.statemachine;
