package com.enms.service;

import com.enms.exception.ConflictException;
import com.enms.exception.NoActiveModelException;
import com.enms.exception.ResourceNotFoundException;
import com.enms.model.ActiveModelPointer;
import com.enms.model.BaselineModel;
import com.enms.model.ModelStatus;
import com.enms.repository.ActiveModelPointerRepository;
import com.enms.repository.BaselineModelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns model status transitions and the per-machine active model pointer.
 *
 * The pointer row is the single source of truth for "which model scores this
 * machine". A swap updates the pointer with compare-and-swap and flips both
 * model statuses in the same transaction, so a reader resolves either the old
 * or the new model and the ACTIVE status count per machine stays at one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelActivationService {

    private final ActiveModelPointerRepository pointerRepository;
    private final BaselineModelRepository modelRepository;

    @Transactional(readOnly = true)
    public Optional<BaselineModel> resolveActive(String machineId) {
        return pointerRepository.findById(machineId)
            .flatMap(pointer -> modelRepository.findById(pointer.getModelId()));
    }

    /**
     * @throws NoActiveModelException if the machine has never had a model activated
     */
    @Transactional(readOnly = true)
    public BaselineModel requireActive(String machineId) {
        return resolveActive(machineId)
            .orElseThrow(() -> new NoActiveModelException("Machine " + machineId + " has no active baseline model"));
    }

    @Transactional(readOnly = true)
    public BaselineModel getModel(UUID modelId) {
        return modelRepository.findById(modelId)
            .orElseThrow(() -> new ResourceNotFoundException("Baseline model " + modelId + " not found"));
    }

    @Transactional(readOnly = true)
    public List<BaselineModel> listModels(String machineId) {
        return modelRepository.findByMachineIdOrderByVersionDesc(machineId);
    }

    /**
     * Activate a machine's first model. There is nothing to compare it against,
     * so no A/B trial is opened.
     */
    @Transactional
    public BaselineModel activateFirst(BaselineModel model) {
        String machineId = model.getMachineId();
        if (pointerRepository.existsById(machineId)) {
            throw new ConflictException("Machine " + machineId + " already has an active model");
        }
        BaselineModel managed = getModel(model.getId());
        managed.setStatus(ModelStatus.ACTIVE);
        modelRepository.save(managed);
        pointerRepository.save(ActiveModelPointer.builder()
            .machineId(machineId)
            .modelId(managed.getId())
            .updatedAt(Instant.now())
            .build());
        log.info("Activated first model {} (v{}) for machine {}", managed.getId(), managed.getVersion(), machineId);
        return managed;
    }

    /**
     * Replace the active model of a machine. Fails if the pointer no longer
     * references {@code expectedModelId}.
     */
    @Transactional
    public void swap(String machineId, UUID expectedModelId, UUID newModelId) {
        BaselineModel incoming = getModel(newModelId);
        if (!incoming.getMachineId().equals(machineId)) {
            throw new ConflictException("Model " + newModelId + " belongs to machine " + incoming.getMachineId());
        }
        int updated = pointerRepository.compareAndSwap(machineId, expectedModelId, newModelId, Instant.now());
        if (updated != 1) {
            throw new ConflictException(
                "Active model of machine " + machineId + " is no longer " + expectedModelId);
        }
        // The CAS cleared the persistence context; reload before changing statuses.
        BaselineModel outgoing = getModel(expectedModelId);
        incoming = getModel(newModelId);
        outgoing.setStatus(ModelStatus.RETIRED);
        incoming.setStatus(ModelStatus.ACTIVE);
        modelRepository.save(outgoing);
        modelRepository.save(incoming);
        log.info("Swapped active model for machine {}: {} (v{}) -> {} (v{})",
            machineId, outgoing.getId(), outgoing.getVersion(), incoming.getId(), incoming.getVersion());
    }

    /**
     * Mark a model as the machine's challenger. Any other challenger is retired
     * so that at most one exists.
     */
    @Transactional
    public BaselineModel markChallenger(UUID modelId) {
        BaselineModel model = getModel(modelId);
        for (BaselineModel other : modelRepository.findByMachineIdAndStatus(model.getMachineId(), ModelStatus.CHALLENGER)) {
            if (!other.getId().equals(modelId)) {
                other.setStatus(ModelStatus.RETIRED);
                modelRepository.save(other);
                log.info("Retired previous challenger {} for machine {}", other.getId(), model.getMachineId());
            }
        }
        model.setStatus(ModelStatus.CHALLENGER);
        return modelRepository.save(model);
    }

    @Transactional
    public void retire(UUID modelId) {
        BaselineModel model = getModel(modelId);
        if (model.getStatus() == ModelStatus.ACTIVE) {
            throw new ConflictException("Model " + modelId + " is active and cannot be retired directly");
        }
        model.setStatus(ModelStatus.RETIRED);
        modelRepository.save(model);
    }
}
