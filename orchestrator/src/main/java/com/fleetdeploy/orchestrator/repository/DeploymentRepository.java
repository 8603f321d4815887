package com.fleetdeploy.orchestrator.repository;

import com.fleetdeploy.orchestrator.model.Deployment;
import com.fleetdeploy.orchestrator.model.DeploymentState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the deployments table.
 */
public interface DeploymentRepository extends JpaRepository<Deployment, UUID> {

    /** Rows in any of the given states (startup recovery uses PENDING + RUNNING). */
    List<Deployment> findByStateIn(Collection<DeploymentState> states);

    /** Most recent deployments first, for the listing endpoint. */
    List<Deployment> findTop50ByOrderByCreatedAtDesc();
}
