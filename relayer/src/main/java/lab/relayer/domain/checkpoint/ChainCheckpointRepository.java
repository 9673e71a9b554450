package lab.relayer.domain.checkpoint;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ChainCheckpointRepository extends JpaRepository<ChainCheckpoint, String> {
}
