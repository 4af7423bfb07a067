package io.github.drompincen.tasksync.gateway.github;

/**
 * GraphQL documents for the Projects v2 API.
 */
final class ProjectQueries {

    private ProjectQueries() {}

    static final String ITEM_FIELDS = """
            id
            isArchived
            fieldValues(first: 20) {
              nodes {
                ... on ProjectV2ItemFieldSingleSelectValue {
                  name
                  field { ... on ProjectV2FieldCommon { name } }
                }
                ... on ProjectV2ItemFieldDateValue {
                  date
                  field { ... on ProjectV2FieldCommon { name } }
                }
              }
            }
            content {
              __typename
              ... on DraftIssue { id title body }
              ... on Issue {
                id title body
                repository { name owner { login } }
                assignees(first: 5) { nodes { login } }
                labels(first: 20) { nodes { name } }
              }
              ... on PullRequest { id title body }
            }
            """;

    static final String PROJECT_ID = """
            query($org: String!, $number: Int!) {
              organization(login: $org) {
                projectV2(number: $number) { id }
              }
            }
            """;

    static final String FIELDS = """
            query($projectId: ID!) {
              node(id: $projectId) {
                ... on ProjectV2 {
                  fields(first: 50) {
                    nodes {
                      ... on ProjectV2Field { id name dataType }
                      ... on ProjectV2SingleSelectField { id name dataType options { id name } }
                      ... on ProjectV2IterationField { id name dataType }
                    }
                  }
                }
              }
            }
            """;

    static final String ITEMS_PAGE = """
            query($projectId: ID!, $cursor: String) {
              node(id: $projectId) {
                ... on ProjectV2 {
                  items(first: 100, after: $cursor) {
                    pageInfo { hasNextPage endCursor }
                    nodes {
            """ + ITEM_FIELDS + """
                    }
                  }
                }
              }
            }
            """;

    static final String ITEM = """
            query($itemId: ID!) {
              node(id: $itemId) {
                ... on ProjectV2Item {
            """ + ITEM_FIELDS + """
                }
              }
            }
            """;

    static final String REPOSITORY = """
            query($owner: String!, $name: String!) {
              repository(owner: $owner, name: $name) {
                id
                labels(first: 100) { nodes { id name } }
              }
            }
            """;

    static final String USER = """
            query($login: String!) {
              user(login: $login) { id }
            }
            """;

    static final String ADD_DRAFT_ISSUE = """
            mutation($projectId: ID!, $title: String!, $body: String) {
              addProjectV2DraftIssue(input: {projectId: $projectId, title: $title, body: $body}) {
                projectItem { id }
              }
            }
            """;

    static final String CREATE_ISSUE = """
            mutation($repositoryId: ID!, $title: String!, $body: String) {
              createIssue(input: {repositoryId: $repositoryId, title: $title, body: $body}) {
                issue { id }
              }
            }
            """;

    static final String ADD_ITEM = """
            mutation($projectId: ID!, $contentId: ID!) {
              addProjectV2ItemById(input: {projectId: $projectId, contentId: $contentId}) {
                item { id }
              }
            }
            """;

    static final String UPDATE_TEXT = """
            mutation($projectId: ID!, $itemId: ID!, $fieldId: ID!, $value: String!) {
              updateProjectV2ItemFieldValue(input: {
                projectId: $projectId, itemId: $itemId, fieldId: $fieldId, value: {text: $value}
              }) { projectV2Item { id } }
            }
            """;

    static final String UPDATE_SINGLE_SELECT = """
            mutation($projectId: ID!, $itemId: ID!, $fieldId: ID!, $optionId: String!) {
              updateProjectV2ItemFieldValue(input: {
                projectId: $projectId, itemId: $itemId, fieldId: $fieldId, value: {singleSelectOptionId: $optionId}
              }) { projectV2Item { id } }
            }
            """;

    static final String UPDATE_DATE = """
            mutation($projectId: ID!, $itemId: ID!, $fieldId: ID!, $value: Date!) {
              updateProjectV2ItemFieldValue(input: {
                projectId: $projectId, itemId: $itemId, fieldId: $fieldId, value: {date: $value}
              }) { projectV2Item { id } }
            }
            """;

    static final String UPDATE_DRAFT_ISSUE = """
            mutation($draftIssueId: ID!, $title: String!, $body: String) {
              updateProjectV2DraftIssue(input: {draftIssueId: $draftIssueId, title: $title, body: $body}) {
                draftIssue { id }
              }
            }
            """;

    static final String UPDATE_ISSUE = """
            mutation($issueId: ID!, $title: String!, $body: String) {
              updateIssue(input: {id: $issueId, title: $title, body: $body}) { issue { id } }
            }
            """;

    static final String SET_ASSIGNEES = """
            mutation($issueId: ID!, $assigneeIds: [ID!]) {
              updateIssue(input: {id: $issueId, assigneeIds: $assigneeIds}) { issue { id } }
            }
            """;

    static final String SET_LABELS = """
            mutation($issueId: ID!, $labelIds: [ID!]) {
              updateIssue(input: {id: $issueId, labelIds: $labelIds}) { issue { id } }
            }
            """;

    static final String ARCHIVE_ITEM = """
            mutation($projectId: ID!, $itemId: ID!) {
              archiveProjectV2Item(input: {projectId: $projectId, itemId: $itemId}) { item { id } }
            }
            """;

    static final String UNARCHIVE_ITEM = """
            mutation($projectId: ID!, $itemId: ID!) {
              unarchiveProjectV2Item(input: {projectId: $projectId, itemId: $itemId}) { item { id } }
            }
            """;

    static final String REOPEN_ISSUE = """
            mutation($issueId: ID!) {
              reopenIssue(input: {issueId: $issueId}) { issue { id } }
            }
            """;
}
