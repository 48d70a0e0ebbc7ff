package com.tuorg.programservice.service;

import com.tuorg.programservice.model.ProgramTemplate;

import java.util.List;

public class TemplateMatch {

    private final ProgramTemplate template;
    private final double score;
    private final List<String> matchReasons;

    public TemplateMatch(ProgramTemplate template, double score, List<String> matchReasons) {
        this.template = template;
        this.score = score;
        this.matchReasons = List.copyOf(matchReasons);
    }

    public ProgramTemplate getTemplate() { return template; }
    public double getScore() { return score; }
    public List<String> getMatchReasons() { return matchReasons; }
}
