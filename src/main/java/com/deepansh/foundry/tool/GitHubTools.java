package com.deepansh.foundry.tool;

import java.util.List;

/**
 * The GitHub MCP tools this service knows how to advertise.
 * Which of them are actually enabled is decided by configuration (see {@link ToolCatalog}).
 */
public final class GitHubTools {

    public static final String SEARCH_REPOSITORIES = "search_repositories";
    public static final String GET_FILE_CONTENTS = "get_file_contents";
    public static final String CREATE_OR_UPDATE_FILE = "create_or_update_file";
    public static final String LIST_ISSUES = "list_issues";
    public static final String CREATE_ISSUE = "create_issue";
    public static final String CREATE_PULL_REQUEST = "create_pull_request";

    private GitHubTools() {
    }

    public static List<McpTool> all() {
        return List.of(
                McpTool.named(SEARCH_REPOSITORIES)
                        .description("Search for GitHub repositories using GitHub search syntax in 'query' "
                                + "(e.g., 'language:javascript pushed:>=2026-01-01'). "
                                + "Do not pass sort-only strings like 'sort:updated-desc' as the query.")
                        .required("query", "GitHub repository search query (must include at least one keyword "
                                + "or qualifier, e.g. 'azure pushed:>=2026-01-01' or 'language:javascript stars:>100')")
                        .build(),
                McpTool.named(GET_FILE_CONTENTS)
                        .description("Get the contents of a file from a GitHub repository")
                        .required("owner", "Repository owner")
                        .required("repo", "Repository name")
                        .required("path", "File path")
                        .build(),
                McpTool.named(CREATE_OR_UPDATE_FILE)
                        .description("Create or update a file in a GitHub repository")
                        .required("owner", "Repository owner")
                        .required("repo", "Repository name")
                        .required("path", "File path")
                        .required("content", "File content")
                        .required("message", "Commit message")
                        .required("branch", "Branch name")
                        .build(),
                McpTool.named(LIST_ISSUES)
                        .description("List issues in a GitHub repository")
                        .required("owner", "Repository owner")
                        .required("repo", "Repository name")
                        .build(),
                McpTool.named(CREATE_ISSUE)
                        .description("Create a new issue in a GitHub repository")
                        .required("owner", "Repository owner")
                        .required("repo", "Repository name")
                        .required("title", "Issue title")
                        .optional("body", "Issue body")
                        .build(),
                McpTool.named(CREATE_PULL_REQUEST)
                        .description("Create a new pull request in a GitHub repository")
                        .required("owner", "Repository owner")
                        .required("repo", "Repository name")
                        .required("title", "PR title")
                        .optional("body", "PR body")
                        .required("head", "Source branch")
                        .required("base", "Target branch")
                        .build()
        );
    }
}
