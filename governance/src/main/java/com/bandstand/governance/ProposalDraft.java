/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * The content of a proposal as supplied by its creator. Beyond title and description, the fields are opaque to the
 * engine: they are stored and returned, never interpreted.
 */
public record ProposalDraft(String title, String description, ProposalType type, Priority priority,
                            String problemStatement, String expectedOutcome, BigDecimal budgetRequested,
                            LocalDate proposedStartDate, LocalDate proposedEndDate, String milestones) {

    public ProposalDraft {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(description, "description");
        type = type == null ? ProposalType.GENERAL : type;
        priority = priority == null ? Priority.MEDIUM : priority;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private BigDecimal   budgetRequested;
        private String       description;
        private String       expectedOutcome;
        private String       milestones;
        private Priority     priority = Priority.MEDIUM;
        private String       problemStatement;
        private LocalDate    proposedEndDate;
        private LocalDate    proposedStartDate;
        private String       title;
        private ProposalType type     = ProposalType.GENERAL;

        public ProposalDraft build() {
            return new ProposalDraft(title, description, type, priority, problemStatement, expectedOutcome,
                                     budgetRequested, proposedStartDate, proposedEndDate, milestones);
        }

        public BigDecimal getBudgetRequested() {
            return budgetRequested;
        }

        public Builder setBudgetRequested(BigDecimal budgetRequested) {
            this.budgetRequested = budgetRequested;
            return this;
        }

        public String getDescription() {
            return description;
        }

        public Builder setDescription(String description) {
            this.description = description;
            return this;
        }

        public String getExpectedOutcome() {
            return expectedOutcome;
        }

        public Builder setExpectedOutcome(String expectedOutcome) {
            this.expectedOutcome = expectedOutcome;
            return this;
        }

        public String getMilestones() {
            return milestones;
        }

        public Builder setMilestones(String milestones) {
            this.milestones = milestones;
            return this;
        }

        public Priority getPriority() {
            return priority;
        }

        public Builder setPriority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public String getProblemStatement() {
            return problemStatement;
        }

        public Builder setProblemStatement(String problemStatement) {
            this.problemStatement = problemStatement;
            return this;
        }

        public LocalDate getProposedEndDate() {
            return proposedEndDate;
        }

        public Builder setProposedEndDate(LocalDate proposedEndDate) {
            this.proposedEndDate = proposedEndDate;
            return this;
        }

        public LocalDate getProposedStartDate() {
            return proposedStartDate;
        }

        public Builder setProposedStartDate(LocalDate proposedStartDate) {
            this.proposedStartDate = proposedStartDate;
            return this;
        }

        public String getTitle() {
            return title;
        }

        public Builder setTitle(String title) {
            this.title = title;
            return this;
        }

        public ProposalType getType() {
            return type;
        }

        public Builder setType(ProposalType type) {
            this.type = type;
            return this;
        }
    }
}
