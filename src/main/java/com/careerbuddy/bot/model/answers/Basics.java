package com.careerbuddy.bot.model.answers;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Basics implements Serializable {

    private String name;

    private String email;

    private String phone;

    private String location;
}
