// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package build.solution.format;

import build.solution.model.OpaqueSection;
import build.solution.model.ProjectConfiguration;
import build.solution.model.ProjectEntry;
import build.solution.model.ProjectReference;
import build.solution.model.ProjectType;
import build.solution.model.SolutionConfiguration;
import build.solution.model.SolutionModel;
import build.solution.model.SolutionModelException;
import build.solution.model.WebCompilerParameters;
import build.solution.syntax.SectionOrder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Reads and writes the structured XML format.
 *
 * <p>A document has a {@code Solution} root with the solution configurations, the uninterpreted
 * global sections, and one {@code Project} element per entry in declaration order:
 *
 * <pre>{@code
 * <Solution FormatVersion="12.00" VisualStudioVersion="17.0.31903.59">
 *   <Configurations>
 *     <Configuration Name="Debug" Platform="Any CPU"/>
 *   </Configurations>
 *   <Section Name="SolutionProperties" Order="preSolution">
 *     <Property Key="HideSolutionNode" Value="FALSE"/>
 *   </Section>
 *   <Project Id="{...}" Name="App" Path="App\App.csproj" Type="{...}" Parent="{...}">
 *     <BuildDependency Project="{...}"/>
 *     <ConfigurationMapping Solution="Debug|Any CPU" Configuration="Debug" Platform="Any CPU"
 *         Build="true"/>
 *   </Project>
 * </Solution>
 * }</pre>
 *
 * Web projects add {@code ProjectReference}, {@code TargetFramework}, {@code WebCompiler} and
 * {@code WebsiteProperty} children. Work runs on the given executor.
 */
public final class XmlSolutionSerializer implements SolutionSerializer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final String SOLUTION = "Solution";
  private static final String CONFIGURATIONS = "Configurations";
  private static final String CONFIGURATION = "Configuration";
  private static final String SECTION = "Section";
  private static final String PROPERTY = "Property";
  private static final String PROJECT = "Project";
  private static final String BUILD_DEPENDENCY = "BuildDependency";
  private static final String PROJECT_REFERENCE = "ProjectReference";
  private static final String TARGET_FRAMEWORK = "TargetFramework";
  private static final String WEB_COMPILER = "WebCompiler";
  private static final String CONFIGURATION_MAPPING = "ConfigurationMapping";
  private static final String WEBSITE_PROPERTY = "WebsiteProperty";

  private static final String FORMAT_VERSION = "FormatVersion";
  private static final String PRODUCT_DESCRIPTION = "ProductDescription";
  private static final String VISUAL_STUDIO_VERSION = "VisualStudioVersion";
  private static final String MINIMUM_VISUAL_STUDIO_VERSION = "MinimumVisualStudioVersion";
  private static final String NAME = "Name";
  private static final String PLATFORM = "Platform";
  private static final String ORDER = "Order";
  private static final String KEY = "Key";
  private static final String VALUE = "Value";
  private static final String ID = "Id";
  private static final String PATH = "Path";
  private static final String TYPE = "Type";
  private static final String PARENT = "Parent";
  private static final String MONIKER = "Moniker";
  private static final String SOLUTION_CONFIGURATION = "Solution";
  private static final String BUILD = "Build";

  private final ListeningExecutorService executor;

  public XmlSolutionSerializer(ListeningExecutorService executor) {
    this.executor = executor;
  }

  /** Returns a serializer that does its work on the calling thread. */
  public XmlSolutionSerializer() {
    this(MoreExecutors.newDirectExecutorService());
  }

  @Override
  public SolutionFormat format() {
    return SolutionFormat.STRUCTURED;
  }

  @Override
  public ListenableFuture<SolutionModel> openAsync(Path path) {
    return executor.submit(() -> read(path));
  }

  @Override
  public ListenableFuture<Void> saveAsync(Path path, SolutionModel model) {
    return executor.submit(
        () -> {
          write(path, model);
          return null;
        });
  }

  private static SolutionModel read(Path path)
      throws SolutionFormatException, SolutionModelException {
    Document document;
    try (InputStream in = Files.newInputStream(path)) {
      document = newDocumentBuilder(path).parse(in);
    } catch (IOException e) {
      throw new SolutionFormatException(path, "cannot read solution: " + e.getMessage(), e);
    } catch (SAXException e) {
      throw new SolutionFormatException(path, "malformed solution document: " + e.getMessage(), e);
    }

    Element root = document.getDocumentElement();
    if (!root.getTagName().equals(SOLUTION)) {
      throw new SolutionFormatException(
          path, "expected a <" + SOLUTION + "> root element, found <" + root.getTagName() + ">");
    }

    SolutionModel.Builder model =
        SolutionModel.builder(path.toString())
            .setFormatVersion(required(path, root, FORMAT_VERSION))
            .setProductDescription(optional(root, PRODUCT_DESCRIPTION))
            .setVisualStudioVersion(optional(root, VISUAL_STUDIO_VERSION))
            .setMinimumVisualStudioVersion(optional(root, MINIMUM_VISUAL_STUDIO_VERSION));
    for (Element child : children(root, CONFIGURATIONS)) {
      for (Element configuration : children(child, CONFIGURATION)) {
        model.addSolutionConfiguration(
            new SolutionConfiguration(
                required(path, configuration, NAME), required(path, configuration, PLATFORM)));
      }
    }
    for (Element section : children(root, SECTION)) {
      model.addGlobalSection(readSection(path, section));
    }
    for (Element project : children(root, PROJECT)) {
      model.addProject(readProject(path, project));
    }
    SolutionModel result = model.build();
    logger.atFine().log("Read %d projects from %s", result.getProjects().size(), path);
    return result;
  }

  private static ProjectEntry readProject(Path path, Element element)
      throws SolutionFormatException {
    String typeToken = required(path, element, TYPE);
    ProjectEntry.Builder project =
        ProjectEntry.builder()
            .id(required(path, element, ID))
            .name(required(path, element, NAME))
            .relativePath(required(path, element, PATH))
            .typeToken(typeToken)
            .type(ProjectType.classify(typeToken))
            .parentId(optional(element, PARENT));

    ImmutableList.Builder<String> dependencies = ImmutableList.builder();
    for (Element dependency : children(element, BUILD_DEPENDENCY)) {
      dependencies.add(required(path, dependency, PROJECT));
    }
    ImmutableList.Builder<ProjectReference> references = ImmutableList.builder();
    for (Element reference : children(element, PROJECT_REFERENCE)) {
      references.add(
          new ProjectReference(
              required(path, reference, PROJECT), required(path, reference, NAME)));
    }
    for (Element framework : children(element, TARGET_FRAMEWORK)) {
      project.targetFrameworkMoniker(required(path, framework, MONIKER));
    }
    ImmutableMap.Builder<String, WebCompilerParameters> webConfigurations = ImmutableMap.builder();
    for (Element compiler : children(element, WEB_COMPILER)) {
      WebCompilerParameters.Builder parameters = WebCompilerParameters.builder();
      for (WebCompilerParameters.Field field : WebCompilerParameters.Field.values()) {
        String value = optional(compiler, field.declaredName());
        parameters.set(field, value == null ? "" : value);
      }
      webConfigurations.put(required(path, compiler, CONFIGURATION), parameters.build());
    }
    ImmutableMap.Builder<String, ProjectConfiguration> configurations = ImmutableMap.builder();
    for (Element mapping : children(element, CONFIGURATION_MAPPING)) {
      configurations.put(
          required(path, mapping, SOLUTION_CONFIGURATION),
          new ProjectConfiguration(
              required(path, mapping, CONFIGURATION),
              required(path, mapping, PLATFORM),
              Boolean.parseBoolean(required(path, mapping, BUILD))));
    }
    ImmutableList.Builder<OpaqueSection.Entry> websiteProperties = ImmutableList.builder();
    for (Element property : children(element, WEBSITE_PROPERTY)) {
      websiteProperties.add(readEntry(path, property));
    }
    ImmutableList.Builder<OpaqueSection> sections = ImmutableList.builder();
    for (Element section : children(element, SECTION)) {
      sections.add(readSection(path, section));
    }

    try {
      return project
          .dependencies(dependencies.build())
          .projectReferenceEntries(references.build())
          .webConfigurations(webConfigurations.buildOrThrow())
          .projectConfigurations(configurations.buildOrThrow())
          .websiteProperties(websiteProperties.build())
          .sections(sections.build())
          .build();
    } catch (IllegalArgumentException e) {
      throw new SolutionFormatException(
          path, "duplicate configuration in project " + element.getAttribute(ID), e);
    }
  }

  private static OpaqueSection readSection(Path path, Element element)
      throws SolutionFormatException {
    String orderToken = required(path, element, ORDER);
    SectionOrder order = SectionOrder.fromToken(orderToken);
    if (order == null) {
      throw new SolutionFormatException(path, "invalid section order '" + orderToken + "'");
    }
    ImmutableList.Builder<OpaqueSection.Entry> entries = ImmutableList.builder();
    for (Element property : children(element, PROPERTY)) {
      entries.add(readEntry(path, property));
    }
    return new OpaqueSection(required(path, element, NAME), order, entries.build());
  }

  private static OpaqueSection.Entry readEntry(Path path, Element element)
      throws SolutionFormatException {
    return new OpaqueSection.Entry(required(path, element, KEY), optional(element, VALUE));
  }

  private static void write(Path path, SolutionModel model) throws SolutionFormatException {
    Document document = newDocumentBuilder(path).newDocument();
    Element root = document.createElement(SOLUTION);
    document.appendChild(root);
    root.setAttribute(FORMAT_VERSION, model.getFormatVersion());
    setOptional(root, PRODUCT_DESCRIPTION, model.getProductDescription());
    setOptional(root, VISUAL_STUDIO_VERSION, model.getVisualStudioVersion());
    setOptional(root, MINIMUM_VISUAL_STUDIO_VERSION, model.getMinimumVisualStudioVersion());

    if (!model.getSolutionConfigurations().isEmpty()) {
      Element configurations = append(root, CONFIGURATIONS);
      for (SolutionConfiguration configuration : model.getSolutionConfigurations()) {
        Element element = append(configurations, CONFIGURATION);
        element.setAttribute(NAME, configuration.configurationName());
        element.setAttribute(PLATFORM, configuration.platformName());
      }
    }
    for (OpaqueSection section : model.getGlobalSections()) {
      writeSection(root, section);
    }
    for (ProjectEntry project : model.getProjects()) {
      writeProject(root, project);
    }

    try (OutputStream out = Files.newOutputStream(path)) {
      Transformer transformer = TransformerFactory.newInstance().newTransformer();
      transformer.setOutputProperty(OutputKeys.INDENT, "yes");
      transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
      transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
      transformer.transform(new DOMSource(document), new StreamResult(out));
    } catch (IOException e) {
      throw new SolutionFormatException(path, "cannot write solution: " + e.getMessage(), e);
    } catch (TransformerException e) {
      throw new SolutionFormatException(path, "cannot serialize solution: " + e.getMessage(), e);
    }
    logger.atFine().log("Wrote %d projects to %s", model.getProjects().size(), path);
  }

  private static void writeProject(Element root, ProjectEntry project) {
    Element element = append(root, PROJECT);
    element.setAttribute(ID, project.id());
    element.setAttribute(NAME, project.name());
    element.setAttribute(PATH, project.relativePath());
    element.setAttribute(TYPE, project.typeToken());
    setOptional(element, PARENT, project.parentId());

    for (String dependency : project.dependencies()) {
      append(element, BUILD_DEPENDENCY).setAttribute(PROJECT, dependency);
    }
    for (ProjectReference reference : project.projectReferenceEntries()) {
      Element child = append(element, PROJECT_REFERENCE);
      child.setAttribute(PROJECT, reference.id());
      child.setAttribute(NAME, reference.displayName());
    }
    if (project.targetFrameworkMoniker() != null) {
      append(element, TARGET_FRAMEWORK).setAttribute(MONIKER, project.targetFrameworkMoniker());
    }
    for (Map.Entry<String, WebCompilerParameters> entry : project.webConfigurations().entrySet()) {
      Element child = append(element, WEB_COMPILER);
      child.setAttribute(CONFIGURATION, entry.getKey());
      for (WebCompilerParameters.Field field : WebCompilerParameters.Field.values()) {
        String value = entry.getValue().get(field);
        if (!value.isEmpty()) {
          child.setAttribute(field.declaredName(), value);
        }
      }
    }
    for (Map.Entry<String, ProjectConfiguration> entry :
        project.projectConfigurations().entrySet()) {
      Element child = append(element, CONFIGURATION_MAPPING);
      child.setAttribute(SOLUTION_CONFIGURATION, entry.getKey());
      child.setAttribute(CONFIGURATION, entry.getValue().configurationName());
      child.setAttribute(PLATFORM, entry.getValue().platformName());
      child.setAttribute(BUILD, Boolean.toString(entry.getValue().buildEnabled()));
    }
    for (OpaqueSection.Entry property : project.websiteProperties()) {
      writeEntry(append(element, WEBSITE_PROPERTY), property);
    }
    for (OpaqueSection section : project.sections()) {
      writeSection(element, section);
    }
  }

  private static void writeSection(Element parent, OpaqueSection section) {
    Element element = append(parent, SECTION);
    element.setAttribute(NAME, section.name());
    element.setAttribute(ORDER, section.order().token());
    for (OpaqueSection.Entry entry : section.entries()) {
      writeEntry(append(element, PROPERTY), entry);
    }
  }

  private static void writeEntry(Element element, OpaqueSection.Entry entry) {
    element.setAttribute(KEY, entry.key());
    setOptional(element, VALUE, entry.value());
  }

  private static DocumentBuilder newDocumentBuilder(Path path) throws SolutionFormatException {
    // DocumentBuilders are not thread-safe; each request gets its own.
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    try {
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      return factory.newDocumentBuilder();
    } catch (ParserConfigurationException e) {
      throw new SolutionFormatException(path, "cannot configure XML parser", e);
    }
  }

  private static Element append(Element parent, String tagName) {
    Element child = parent.getOwnerDocument().createElement(tagName);
    parent.appendChild(child);
    return child;
  }

  private static void setOptional(Element element, String name, @Nullable String value) {
    if (value != null) {
      element.setAttribute(name, value);
    }
  }

  // Direct child elements with the given tag name, in document order.
  private static List<Element> children(Element parent, String tagName) {
    List<Element> result = new ArrayList<>();
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE && node.getNodeName().equals(tagName)) {
        result.add((Element) node);
      }
    }
    return result;
  }

  private static String required(Path path, Element element, String attribute)
      throws SolutionFormatException {
    if (!element.hasAttribute(attribute)) {
      throw new SolutionFormatException(
          path, "<" + element.getTagName() + "> is missing the " + attribute + " attribute");
    }
    return element.getAttribute(attribute);
  }

  @Nullable
  private static String optional(Element element, String attribute) {
    return element.hasAttribute(attribute) ? element.getAttribute(attribute) : null;
  }
}
