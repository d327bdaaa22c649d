package com.dropoutrisk.engine.ml;

import com.dropoutrisk.engine.training.QualityGate;
import com.dropoutrisk.exception.ModelLifecycleException;
import com.dropoutrisk.exception.ModelQualityRegressionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.dropoutrisk.engine.ModelFixtures.staged;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelRegistryTest {

    @Mock
    private ModelArtifactStore store;

    @Mock
    private ModelLifecycleListener listener;

    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistry(store);
        registry.addListener(listener);
    }

    private ModelArtifact promote(String version, double metric) {
        registry.stage(staged(version, metric));
        registry.markValidated(version);
        return registry.promote(version, PromotionGate.ALWAYS);
    }

    @Test
    @DisplayName("Should walk a model through STAGED, VALIDATED and ACTIVE")
    void shouldPromoteThroughLifecycle() {
        ModelArtifact active = promote("v1", 0.8);

        assertThat(active.state()).isEqualTo(LifecycleState.ACTIVE);
        assertThat(registry.active()).contains(active);
        verify(listener).onTransition(any(), isNull(), eq(LifecycleState.STAGED));
        verify(listener).onTransition(any(), eq(LifecycleState.STAGED), eq(LifecycleState.VALIDATED));
        verify(listener).onTransition(any(), eq(LifecycleState.VALIDATED), eq(LifecycleState.ACTIVE));
        verify(store).saveActivePointer("v1");
    }

    @Test
    @DisplayName("Should retire the previous active model on promotion")
    void shouldRetirePreviousActive() {
        promote("v1", 0.8);
        promote("v2", 0.85);

        assertThat(registry.active()).map(ModelArtifact::version).contains("v2");
        assertThat(registry.find("v1")).map(ModelArtifact::state).contains(LifecycleState.RETIRED);
        verify(listener).onTransition(argThat(a -> a.version().equals("v1")),
                eq(LifecycleState.ACTIVE), eq(LifecycleState.RETIRED));
    }

    @Test
    @DisplayName("Should persist the new state before swapping the active pointer")
    void shouldPersistBeforeSwap() {
        promote("v1", 0.8);

        InOrder inOrder = inOrder(store);
        inOrder.verify(store).save(argThat(a -> a.state() == LifecycleState.ACTIVE));
        inOrder.verify(store).saveActivePointer("v1");
    }

    @Test
    @DisplayName("Should leave the active model untouched when the gate rejects the candidate")
    void shouldKeepActiveOnRejection() {
        promote("v1", 0.9);
        registry.stage(staged("v2", 0.5));
        registry.markValidated("v2");

        assertThatThrownBy(() -> registry.promote("v2", new QualityGate(0.02)))
                .isInstanceOf(ModelQualityRegressionException.class);

        assertThat(registry.active()).map(ModelArtifact::version).contains("v1");
        assertThat(registry.find("v2")).map(ModelArtifact::state).contains(LifecycleState.VALIDATED);
        verify(listener).onPromotionRejected(argThat(a -> a.version().equals("v2")), anyString());
        verify(store, never()).saveActivePointer("v2");
    }

    @Test
    @DisplayName("Should refuse transitions that skip a lifecycle step")
    void shouldRejectIllegalTransitions() {
        registry.stage(staged("v1", 0.8));

        assertThatThrownBy(() -> registry.promote("v1", PromotionGate.ALWAYS))
                .isInstanceOf(ModelLifecycleException.class)
                .hasMessageContaining("STAGED");
        assertThatThrownBy(() -> registry.markValidated("v9"))
                .isInstanceOf(ModelLifecycleException.class)
                .hasMessageContaining("Unknown model version");
        assertThatThrownBy(() -> registry.stage(staged("v1", 0.8)))
                .isInstanceOf(ModelLifecycleException.class);
    }

    @Test
    @DisplayName("Should hand out increasing version ids")
    void shouldAllocateVersions() {
        assertThat(registry.nextVersion()).isEqualTo("v1");
        registry.stage(staged("v1", 0.8));
        registry.stage(staged("v2", 0.8));
        assertThat(registry.nextVersion()).isEqualTo("v3");
        assertThat(registry.all()).extracting(ModelArtifact::version).containsExactly("v1", "v2");
    }

    @Test
    @DisplayName("Should restore the stored active model without emitting events")
    void shouldRestoreFromStore() {
        ModelArtifact retired = staged("v1", 0.7).withState(LifecycleState.RETIRED);
        ModelArtifact active = staged("v2", 0.8).withState(LifecycleState.ACTIVE);
        when(store.loadAll()).thenReturn(List.of(retired, active));
        when(store.loadActivePointer()).thenReturn(Optional.of("v2"));

        registry.restore();

        assertThat(registry.active()).contains(active);
        assertThat(registry.nextVersion()).isEqualTo("v3");
        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("Should keep the transition when a listener fails")
    void shouldIsolateListenerFailures() {
        lenient().doThrow(new IllegalStateException("listener down")).when(listener)
                .onTransition(any(), any(), eq(LifecycleState.ACTIVE));

        ModelArtifact active = promote("v1", 0.8);

        assertThat(registry.active()).contains(active);
    }

    @Test
    @DisplayName("Should validate and promote a staged model in one step")
    void shouldValidateAndPromote() {
        registry.stage(staged("v1", 0.8));

        ModelArtifact active = registry.validateAndPromote("v1", new QualityGate(0.02));

        assertThat(active.state()).isEqualTo(LifecycleState.ACTIVE);
        assertThat(registry.active()).contains(active);
        InOrder inOrder = inOrder(listener);
        inOrder.verify(listener).onTransition(any(), eq(LifecycleState.STAGED), eq(LifecycleState.VALIDATED));
        inOrder.verify(listener).onTransition(any(), eq(LifecycleState.VALIDATED), eq(LifecycleState.ACTIVE));
    }

    @Test
    @DisplayName("Should leave a staged model STAGED when the one-step promotion is rejected")
    void shouldKeepStagedOnOneStepRejection() {
        promote("v1", 0.9);
        registry.stage(staged("v2", 0.5));

        assertThatThrownBy(() -> registry.validateAndPromote("v2", new QualityGate(0.02)))
                .isInstanceOf(ModelQualityRegressionException.class);

        assertThat(registry.find("v2")).map(ModelArtifact::state).contains(LifecycleState.STAGED);
        assertThat(registry.active()).map(ModelArtifact::version).contains("v1");
        verify(listener).onPromotionRejected(argThat(a -> a.version().equals("v2")), anyString());
        verify(store, never()).save(argThat(a -> a.version().equals("v2") && a.state() != LifecycleState.STAGED));
    }

    @Test
    @DisplayName("Should report a rejection only after releasing the registry lock")
    void shouldNotifyRejectionOutsideLock() {
        AtomicReference<String> versionSeenByListener = new AtomicReference<>();
        registry.addListener(new ModelLifecycleListener() {
            @Override
            public void onTransition(ModelArtifact artifact, LifecycleState from, LifecycleState to) {
            }

            @Override
            public void onPromotionRejected(ModelArtifact staged, String reason) {
                // another thread needs the write lock; this times out if the lock is still held
                try {
                    versionSeenByListener.set(CompletableFuture.supplyAsync(registry::nextVersion)
                            .get(2, TimeUnit.SECONDS));
                } catch (Exception e) {
                    versionSeenByListener.set("blocked: " + e);
                }
            }
        });
        promote("v1", 0.9);
        registry.stage(staged("v2", 0.5));

        assertThatThrownBy(() -> registry.validateAndPromote("v2", new QualityGate(0.02)))
                .isInstanceOf(ModelQualityRegressionException.class);

        assertThat(versionSeenByListener.get()).isEqualTo("v3");
    }

    @Test
    @DisplayName("Should trust the active pointer over stored states when restoring")
    void shouldRepairStatesOnRestore() {
        ModelArtifact pointedTo = staged("v1", 0.7).withState(LifecycleState.RETIRED);
        ModelArtifact halfPromoted = staged("v2", 0.8).withState(LifecycleState.ACTIVE);
        when(store.loadAll()).thenReturn(List.of(pointedTo, halfPromoted));
        when(store.loadActivePointer()).thenReturn(Optional.of("v1"));

        registry.restore();

        assertThat(registry.active()).map(ModelArtifact::version).contains("v1");
        assertThat(registry.find("v1")).map(ModelArtifact::state).contains(LifecycleState.ACTIVE);
        assertThat(registry.find("v2")).map(ModelArtifact::state).contains(LifecycleState.VALIDATED);
        verify(store).save(argThat(a -> a.version().equals("v1") && a.state() == LifecycleState.ACTIVE));
        verify(store).save(argThat(a -> a.version().equals("v2") && a.state() == LifecycleState.VALIDATED));
        verifyNoInteractions(listener);
    }
}
