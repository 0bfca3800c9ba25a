package br.fluitax.kardex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import org.springframework.context.annotation.ComponentScan;

@SpringBootApplication
@ComponentScan(basePackages = "br.fluitax")
public class KardexServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(KardexServiceApplication.class, args);
    }
}
