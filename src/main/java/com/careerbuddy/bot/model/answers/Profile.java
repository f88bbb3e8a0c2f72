package com.careerbuddy.bot.model.answers;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Profile implements Serializable {

    private String platform;

    private String url;
}
