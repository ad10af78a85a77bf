package com.ryuqq.metacache.adapter.runner;

import com.ryuqq.metacache.core.config.LoadOptions;
import com.ryuqq.metacache.core.spi.LoadContext;
import com.ryuqq.metacache.core.spi.LoaderUnit;
import com.ryuqq.metacache.testkit.fixture.TestAsset;
import com.ryuqq.metacache.testkit.fixture.TestMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * FunctionLoaderUnitFactory 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class FunctionLoaderUnitFactoryTest {

    @Mock
    private LoadContext context;

    @Test
    void 조회_성공_시_진행률_1_보고() throws Exception {
        // given
        FunctionLoaderUnitFactory<TestAsset, TestMetadata> factory =
            new FunctionLoaderUnitFactory<>(asset -> new TestMetadata(asset.identifier(), 7));
        LoaderUnit<TestMetadata> unit = factory.create(TestAsset.of("a"), LoadOptions.defaults());
        when(context.isCancelled()).thenReturn(false);

        // when
        TestMetadata result = unit.load(context);

        // then
        assertThat(result).isEqualTo(new TestMetadata("a", 7));
        verify(context).reportProgress(1.0);
    }

    @Test
    void 취소된_unit은_조회하지_않음() throws Exception {
        // given
        AtomicInteger calls = new AtomicInteger();
        FunctionLoaderUnitFactory<TestAsset, TestMetadata> factory = new FunctionLoaderUnitFactory<>(asset -> {
            calls.incrementAndGet();
            return TestMetadata.of(1);
        });
        when(context.isCancelled()).thenReturn(true);

        // when
        TestMetadata result = factory.create(TestAsset.of("a"), LoadOptions.defaults()).load(context);

        // then
        assertThat(result).isNull();
        assertThat(calls.get()).isZero();
        verify(context, never()).reportProgress(anyDouble());
    }

    @Test
    void 조회가_null이면_진행률_없이_null_반환() throws Exception {
        // given
        FunctionLoaderUnitFactory<TestAsset, TestMetadata> factory = new FunctionLoaderUnitFactory<>(asset -> null);
        when(context.isCancelled()).thenReturn(false);

        // when
        TestMetadata result = factory.create(TestAsset.of("a"), LoadOptions.defaults()).load(context);

        // then
        assertThat(result).isNull();
        verify(context, never()).reportProgress(anyDouble());
    }

    @Test
    void 조회_예외는_그대로_전파() {
        // given
        FunctionLoaderUnitFactory<TestAsset, TestMetadata> factory = new FunctionLoaderUnitFactory<>(asset -> {
            throw new IOException("offline");
        });
        when(context.isCancelled()).thenReturn(false);

        // when & then
        assertThatThrownBy(() -> factory.create(TestAsset.of("a"), LoadOptions.defaults()).load(context))
            .isInstanceOf(IOException.class)
            .hasMessage("offline");
    }

    @Test
    void fetcher가_null이면_거부() {
        assertThatThrownBy(() -> new FunctionLoaderUnitFactory<TestAsset, TestMetadata>(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("fetcher cannot be null");
    }
}
