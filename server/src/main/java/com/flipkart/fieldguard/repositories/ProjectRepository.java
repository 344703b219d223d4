package com.flipkart.fieldguard.repositories;

import com.flipkart.fieldguard.models.db.Project;
import org.springframework.stereotype.Repository;

@Repository
public class ProjectRepository extends InMemoryRepository<Project> {

    public ProjectRepository() {
        super(Project.KIND);
    }

    @Override
    protected String idOf(Project entity) {
        return entity.getId();
    }

    @Override
    protected void assignId(Project entity, String id) {
        entity.setId(id);
    }
}
