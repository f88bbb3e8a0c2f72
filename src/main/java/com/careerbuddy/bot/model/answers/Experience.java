package com.careerbuddy.bot.model.answers;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class Experience implements Serializable {

    private String role;

    private String company;

    private String city;

    private String start;

    private String end;

    private List<String> bullets = new ArrayList<>();

    public Experience(String role, String company, String city, String start, String end) {
        this.role = role;
        this.company = company;
        this.city = city;
        this.start = start;
        this.end = end;
    }
}
