package com.opentext.tasklist;

import com.opentext.tasklist.model.Task;
import com.opentext.tasklist.model.TaskStore;
import com.opentext.tasklist.repository.TaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;

import java.util.List;

/**
 * Spring Boot entry point. On startup it reports what the configured store currently holds,
 * so a misconfigured path or a corrupt file shows up immediately.
 */
@Slf4j
@SpringBootApplication
public class TaskListApplication {

    public static void main(String[] args) {
        ApplicationContext context = SpringApplication.run(TaskListApplication.class, args);
        TaskStore store = context.getBean(TaskStore.class);
        TaskRepository repository = context.getBean(TaskRepository.class);

        List<Task> tasks = repository.list();
        log.info("Task store {} holds {} task(s)", store.path().toAbsolutePath(), tasks.size());
        for (Task task : tasks) {
            log.info("  #{} [{}] {}", task.getId(), task.isCompleted() ? "x" : " ", task.getTitle());
        }
    }
}
