package com.enms.model;

import com.enms.exception.ErrorCode;
import com.enms.exception.IllegalStateTransitionException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A request to retrain a machine's baseline. Only the retrain coordinator
 * moves it through {@link RetrainJobState}; every mutator goes through
 * {@link #transitionTo} so a terminal job can never be resumed.
 */
@Entity
@Table(name = "retrain_jobs",
    indexes = @Index(name = "idx_job_machine_state", columnList = "machineId,state"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrainJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 50)
    private String machineId;

    /**
     * Active model at enqueue time, null for a machine's first training.
     */
    private UUID triggeringModelId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RetrainTrigger triggerType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RetrainJobState state;

    /**
     * Drivers to train on instead of the active model's driver set.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "retrain_job_drivers", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Column(name = "driver", length = 100)
    @Builder.Default
    private List<String> driverOverride = new ArrayList<>();

    @Column(nullable = false)
    private Instant createdAt;

    private Instant startedAt;

    private Instant finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 40)
    private ErrorCode failureReason;

    @Column(length = 1000)
    private String failureDetail;

    private UUID resultModelId;

    @Version
    private Long lockVersion;

    public void markRunning(Instant now) {
        transitionTo(RetrainJobState.RUNNING);
        this.startedAt = now;
    }

    public void markCompleted(UUID resultModelId, Instant now) {
        transitionTo(RetrainJobState.COMPLETED);
        this.resultModelId = resultModelId;
        this.finishedAt = now;
    }

    public void markFailed(ErrorCode reason, String detail, Instant now) {
        transitionTo(RetrainJobState.FAILED);
        this.failureReason = reason;
        this.failureDetail = detail != null && detail.length() > 1000 ? detail.substring(0, 1000) : detail;
        this.finishedAt = now;
    }

    private void transitionTo(RetrainJobState next) {
        if (state == null || !state.canTransitionTo(next)) {
            throw new IllegalStateTransitionException(
                "Retrain job " + id + " cannot move from " + state + " to " + next);
        }
        this.state = next;
    }
}
