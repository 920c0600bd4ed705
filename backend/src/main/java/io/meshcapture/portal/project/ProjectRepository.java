package io.meshcapture.portal.project;

import io.meshcapture.portal.lifecycle.ProjectState;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  List<Project> findByStateOrderByCreatedAtDesc(ProjectState state);

  List<Project> findAllByOrderByCreatedAtDesc();
}
