package com.careerbuddy.bot.model.answers;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Education implements Serializable {

    private String degree;

    private String school;

    private String year;
}
