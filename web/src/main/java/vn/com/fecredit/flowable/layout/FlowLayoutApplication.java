package vn.com.fecredit.flowable.layout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "vn.com.fecredit.flowable.layout")
public class FlowLayoutApplication {
    public static void main(String[] args) {
        SpringApplication.run(FlowLayoutApplication.class, args);
    }
}
