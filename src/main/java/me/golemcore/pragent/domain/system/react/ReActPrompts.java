package me.golemcore.pragent.domain.system.react;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.pragent.domain.model.RepoLocator;
import me.golemcore.pragent.domain.model.TaskRequest;

final class ReActPrompts {

    static final String SYSTEM_PROMPT = """
            You are an autonomous GitHub PR agent. Create a pull request based on the user's description.

            WORKFLOW (follow strictly in order):
            1. Call get_repo_structure("") to list the root. MANDATORY first step.
            2. Optionally explore subdirectories with get_repo_structure if needed.
            3. Call read_file on every file you plan to modify.
            4. Call commit_files ONCE with ALL changes in a single call.
            5. Call create_pull_request to open the PR.

            COMMIT_FILES FORMAT (most common failure point):
            - "changes" MUST be a proper JSON array, NOT a string.
            - Each element: {"path":"file.css","content":"...full file content...","action":"update"}
            - For "update": include the COMPLETE file content (original + your changes).
            - For "create": include the full new file content.
            - Example call:
              commit_files({
                "branchName": "feature/my-change",
                "changes": [
                  {"path": "app/globals.css", "content": "body { background: black; }\\n", "action": "update"}
                ]
              })

            FILE UPDATE RULES:
            - ALWAYS read_file before modifying. Preserve ALL existing code.
            - Include complete file content in commit_files (existing + modifications).

            ERROR RECOVERY:
            - If a tool fails, read the error and fix the issue. Do NOT repeat the same failing call.
            - If commit_files fails, check your "changes" format and retry with corrected data.
            - Do NOT call get_repo_structure more than twice total. You already have the structure.
            - NEVER repeat the same tool call with the same arguments. Try a different approach.

            PATH RULES:
            - ONLY use paths returned by get_repo_structure. Never guess or invent paths.
            - If read_file returns 404, use get_repo_structure to find the correct path.

            PR RULE:
            - Do NOT call create_pull_request until commit_files has succeeded.""";

    private ReActPrompts() {
    }

    static String userPrompt(RepoLocator locator, TaskRequest request) {
        return "Create a pull request for this repository.\n\n"
                + "Repository: " + locator.fullName() + "\n"
                + "User request: " + request.descriptionOrEmpty() + "\n\n"
                + "Target branch: " + request.resolveTargetBranch() + "\n"
                + "Feature branch (already created for you): " + request.branchName() + "\n\n"
                + "Start by exploring the repository structure, then implement the changes, commit your changes "
                + "to the feature branch, and only then open the pull request.";
    }

    static String loopNudge(String toolName) {
        return "SYSTEM: You are stuck in a loop calling " + toolName + " repeatedly. STOP calling it again. "
                + "Instead:\n"
                + "- If you need to modify a file, call read_file to get its content, then call commit_files.\n"
                + "- If commit_files previously failed, check that \"changes\" is a proper JSON array of objects, "
                + "each with \"path\", \"content\", and \"action\" keys.\n"
                + "- If you have already committed files, call create_pull_request.\n"
                + "- Do NOT call get_repo_structure again. You already have the structure.";
    }
}
