package com.flipkart.fieldguard.controllers;

import com.flipkart.fieldguard.models.db.Announcement;
import com.flipkart.fieldguard.models.db.Expense;
import com.flipkart.fieldguard.models.db.Project;
import com.flipkart.fieldguard.models.db.UserAccount;
import com.flipkart.fieldguard.models.dto.ProjectUpdateInput;
import com.flipkart.fieldguard.models.dto.ProjectUpdatePayload;
import com.flipkart.fieldguard.models.resolved.LazySequence;
import com.flipkart.fieldguard.repositories.ExpenseRepository;
import com.flipkart.fieldguard.repositories.ProjectRepository;
import com.flipkart.fieldguard.repositories.UserAccountRepository;
import graphql.relay.Connection;
import graphql.relay.SimpleListConnection;
import graphql.schema.DataFetchingEnvironment;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Controller;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolvers of the project and expense tracker schema. None of them checks permissions: every value they return is
 * authorized field by field on its way into the response.
 */
@Controller
@RequiredArgsConstructor
public class TrackerController {

    private final ProjectRepository projectRepository;
    private final ExpenseRepository expenseRepository;
    private final UserAccountRepository userAccountRepository;

    @QueryMapping
    public Project project(@Argument String id) {
        return projectRepository.findById(id).orElse(null);
    }

    @QueryMapping
    public Expense expense(@Argument String id) {
        return expenseRepository.findById(id).orElse(null);
    }

    @QueryMapping
    public UserAccount user(@Argument String id) {
        return userAccountRepository.findById(id).orElse(null);
    }

    @QueryMapping
    public LazySequence<Project> projects() {
        return projectRepository.findAll();
    }

    /**
     * Same data as {@link #projects()}, already materialized into a plain list.
     */
    @QueryMapping
    public List<Project> projectsList() {
        return toList(projectRepository.findAll());
    }

    @QueryMapping
    public LazySequence<Expense> expenses() {
        return expenseRepository.findAll();
    }

    @QueryMapping
    public LazySequence<UserAccount> users() {
        return userAccountRepository.findAll();
    }

    /**
     * Projects, then expenses, then a closing announcement.
     */
    @QueryMapping
    public List<Object> activity() {
        List<Object> items = new ArrayList<>();
        projectRepository.findAll().forEach(items::add);
        expenseRepository.findAll().forEach(items::add);
        items.add(new Announcement("End of activity", Instant.now()));
        return items;
    }

    /**
     * Paged with the {@code first}, {@code after}, {@code last} and {@code before} arguments. The page is cut
     * before authorization, so it may hold fewer edges than requested.
     */
    @QueryMapping
    public Connection<Project> projectConnection(DataFetchingEnvironment environment) {
        return new SimpleListConnection<>(toList(projectRepository.findAll())).get(environment);
    }

    @SchemaMapping(typeName = "Project", field = "expenseConnection")
    public Connection<Expense> projectExpenseConnection(Project project, DataFetchingEnvironment environment) {
        return new SimpleListConnection<>(toList(expenseRepository.findByProjectId(project.getId()))).get(environment);
    }

    @SchemaMapping(typeName = "Project", field = "expenses")
    public LazySequence<Expense> projectExpenses(Project project) {
        return expenseRepository.findByProjectId(project.getId());
    }

    /**
     * Renames a project. The mutation itself is not permission checked, only the returned payload is.
     */
    @MutationMapping
    public ProjectUpdatePayload updateProject(@Argument String id, @Argument ProjectUpdateInput input) {
        Project project = projectRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Project not found: " + id));
        project.setName(input.name());
        return new ProjectUpdatePayload(projectRepository.save(project));
    }

    private static <T> List<T> toList(Iterable<T> sequence) {
        List<T> items = new ArrayList<>();
        sequence.forEach(items::add);
        return items;
    }
}
