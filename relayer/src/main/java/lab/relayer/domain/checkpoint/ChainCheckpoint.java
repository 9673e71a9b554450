package lab.relayer.domain.checkpoint;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Lowest block from which a chain's events must be replayed to rebuild coordinator state.
 */
@Entity
@Table(name = "chain_checkpoints")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class ChainCheckpoint {

    @Id
    @Column(nullable = false, length = 64)
    private String chain;

    @Column(nullable = false)
    private long safeBlock;

    @Column(nullable = false)
    private Instant updatedAt;

    public void advanceTo(long block, Instant now) {
        if (block < this.safeBlock) {
            return;
        }
        this.safeBlock = block;
        this.updatedAt = now;
    }
}
