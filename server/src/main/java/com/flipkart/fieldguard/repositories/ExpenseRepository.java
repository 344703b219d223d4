package com.flipkart.fieldguard.repositories;

import com.flipkart.fieldguard.models.db.Expense;
import com.flipkart.fieldguard.models.resolved.LazySequence;
import org.springframework.stereotype.Repository;

@Repository
public class ExpenseRepository extends InMemoryRepository<Expense> {

    public ExpenseRepository() {
        super(Expense.KIND);
    }

    public LazySequence<Expense> findByProjectId(String projectId) {
        return query(expense -> expense.getProject() != null && projectId.equals(expense.getProject().getId()));
    }

    @Override
    protected String idOf(Expense entity) {
        return entity.getId();
    }

    @Override
    protected void assignId(Expense entity, String id) {
        entity.setId(id);
    }
}
