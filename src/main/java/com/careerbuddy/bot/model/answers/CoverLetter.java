package com.careerbuddy.bot.model.answers;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class CoverLetter implements Serializable {

    private String role;

    private String company;

    private String yearsExperience;

    private String industries;

    private String interestReason;

    private String currentTitle;

    private String currentEmployer;

    private String achievement1;

    private String achievement2;

    private List<String> keySkills = new ArrayList<>();

    private String companyGoal;
}
