package org.buaa.imagesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
public class ImageSearchApp {

    public static void main(String[] args) {
         SpringApplication.run(ImageSearchApp.class, args);
    }
}
