package zoho.contacts.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.PropertySource;


@ComponentScan(basePackages = "zoho.contacts.app")
@PropertySource(value = "file:./secrets.properties", ignoreResourceNotFound = true)
@SpringBootApplication()
public class ContactsApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ContactsApplication.class, args)));
    }

}
