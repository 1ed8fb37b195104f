package com.forgebot.worker.external;

/** Surfaces permanent failures to users as repository issues. Never throws. */
public interface IssueNotifier {

    void openIssue(String repoUrl, String title, String body);
}
