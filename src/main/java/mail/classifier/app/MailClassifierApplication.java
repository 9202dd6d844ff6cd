package mail.classifier.app;

import mail.classifier.app.config.MailClassifierProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(MailClassifierProperties.class)
@SpringBootApplication
public class MailClassifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailClassifierApplication.class, args);
    }

}
