package io.github.drompincen.pocpilot.runtime.domain;

import io.github.drompincen.pocpilot.runtime.security.CallerIdentity;

import java.util.List;
import java.util.Optional;

/**
 * Read port over the POC domain. Every query is answered from the caller's point of view:
 * only the caller's tenant, and for roles without tenant-wide visibility only POCs the caller
 * created or participates in.
 */
public interface PocDirectory {

    List<PocSummary> activePocs(CallerIdentity caller);

    /** Empty when the POC does not exist or the caller may not see it. */
    Optional<PocSummary> visiblePoc(CallerIdentity caller, String pocId);

    /** Empty when the POC is not visible to the caller. */
    List<TaskSummary> tasks(CallerIdentity caller, String pocId);

    /** Active tenant members that can be assigned to POC work. */
    List<UserSummary> eligibleUsers(CallerIdentity caller);
}
