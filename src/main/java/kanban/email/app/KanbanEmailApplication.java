package kanban.email.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KanbanEmailApplication {

    public static void main(String[] args) {
        SpringApplication.run(KanbanEmailApplication.class, args);
    }

}
