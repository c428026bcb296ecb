package net.clusterpool.core.service;

import java.time.Duration;

/** What one scheduling pass did. */
public record PassReport(
        int clustersReconciled,
        int workUnitsReconciled,
        int placements,
        int clustersCreated,
        int badConfig,
        int errors,
        int clustersTerminated,
        Duration elapsed
) {
    static PassReport of(ReconciliationService.Result recon, AssignmentService.Result assign, int terminated,
                         Duration elapsed) {
        return new PassReport(recon.clusters(), recon.workUnits(), assign.placed(), assign.clustersCreated(),
                assign.badConfig(), assign.errors(), terminated, elapsed);
    }
}
