package quest.gekko.pricewatch.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "collector_run")
@Getter @Setter
public class CollectorRun {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(nullable = false)
    String jobName;

    @Column(nullable = false)
    Instant startedAt;

    Instant finishedAt;

    int attempted;
    int succeeded;
    int failed;
    int storageErrors;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    RunStatus status;
}
